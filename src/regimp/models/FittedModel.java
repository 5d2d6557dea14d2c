/*
 *   This program is free software: you can redistribute it and/or modify
 *   it under the terms of the GNU General Public License as published by
 *   the Free Software Foundation, either version 3 of the License, or
 *   (at your option) any later version.
 *
 *   This program is distributed in the hope that it will be useful,
 *   but WITHOUT ANY WARRANTY; without even the implied warranty of
 *   MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *   GNU General Public License for more details.
 *
 *   You should have received a copy of the GNU General Public License
 *   along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

 /*
 *    FittedModel.java
 *
 */
package regimp.models;

import weka.core.Instances;

/**
 * A model fitted for one target attribute.
 */
public interface FittedModel {

    /**
     * Predicts the target for every row.
     *
     * @param data rows with the same attributes as the data the model was
     * fitted on
     * @param mode what to return per row
     * @return one array per row: a single value for {@link PredictionMode#POINT},
     * {@link PredictionMode#RESPONSE} and
     * {@link PredictionMode#RESPONSE_PROBABILITY}, one probability per level
     * for {@link PredictionMode#CLASS_PROBABILITIES}
     * @throws Exception if prediction fails
     */
    double[][] predict(Instances data, PredictionMode mode) throws Exception;
}

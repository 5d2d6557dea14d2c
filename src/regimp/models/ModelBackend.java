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
 *    ModelBackend.java
 *
 */
package regimp.models;

import java.util.List;
import weka.core.Instances;

/**
 * Fits the regression and classification models used to impute a target.
 */
public interface ModelBackend {

    /**
     * Fits the routine of <code>choice</code> for <code>target ~ predictors</code>.
     *
     * @param choice routine, family and prediction mode for the target
     * @param target name of the target attribute
     * @param predictors names of the predictor attributes
     * @param data rows to fit on: the target is present and no predictor is
     * missing. May hold further attributes, which are ignored.
     * @return the fitted model
     * @throws Exception if the model cannot be fitted
     */
    FittedModel fit(ModelChoice choice, String target, List<String> predictors, Instances data)
            throws Exception;
}

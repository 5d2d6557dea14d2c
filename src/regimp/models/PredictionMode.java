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
 *    PredictionMode.java
 *
 */
package regimp.models;

/**
 * What a fitted model returns for each row it predicts.
 */
public enum PredictionMode {

    /** One value: the predicted mean of a numeric target */
    POINT,

    /** One value: probability of the second level of a two-level target */
    RESPONSE_PROBABILITY,

    /** One probability per level of the target */
    CLASS_PROBABILITIES,

    /** One value: the predicted mean on the response scale of a GLM */
    RESPONSE
}

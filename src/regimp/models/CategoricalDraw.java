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
 *    CategoricalDraw.java
 *
 */
package regimp.models;

import regimp.core.ModelFitException;

/**
 * Resolves the predicted distribution over the levels of a nominal target to
 * one level.
 */
public abstract class CategoricalDraw {

    /**
     * @param probabilities one probability per level
     * @return index of the chosen level
     * @throws ModelFitException if the probabilities are not a distribution
     */
    public int draw(double[] probabilities) throws ModelFitException {
        double total = 0;
        for (double p : probabilities) {
            if (Double.isNaN(p) || p < 0 || Double.isInfinite(p)) {
                throw new ModelFitException("Invalid predicted probability " + p);
            }
            total += p;
        }
        if (probabilities.length == 0 || total <= 0) {
            throw new ModelFitException("Predicted probabilities do not form a distribution");
        }
        return choose(probabilities, total);
    }

    /**
     * Distribution over a two-level target given the probability of the
     * second level.
     *
     * @param p probability of the second level
     * @return <code>{1 - p, p}</code>
     */
    public static double[] binary(double p) {
        return new double[] {1.0 - p, p};
    }

    /**
     * @param probabilities validated probabilities
     * @param total their sum, greater than zero
     * @return index of the chosen level
     */
    protected abstract int choose(double[] probabilities, double total);
}

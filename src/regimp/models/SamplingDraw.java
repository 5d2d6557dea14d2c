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
 *    SamplingDraw.java
 *
 */
package regimp.models;

import java.util.Random;

/**
 * Samples a level from the predicted distribution.
 */
public class SamplingDraw extends CategoricalDraw {

    private final Random m_random;

    /**
     * @param random source of the draws, owned by the caller
     */
    public SamplingDraw(Random random) {
        m_random = random;
    }

    @Override
    protected int choose(double[] probabilities, double total) {
        double u = m_random.nextDouble() * total;
        double cumulative = 0;
        for (int i = 0; i < probabilities.length; i++) {
            cumulative += probabilities[i];
            if (u < cumulative) {
                return i;
            }
        }
        // rounding left u at the very top
        for (int i = probabilities.length - 1; i > 0; i--) {
            if (probabilities[i] > 0) {
                return i;
            }
        }
        return 0;
    }
}

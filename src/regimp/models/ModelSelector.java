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
 *    ModelSelector.java
 *
 */
package regimp.models;

import regimp.core.Family;
import regimp.core.FamilySelector;
import regimp.core.UnsupportedFamilyException;
import weka.core.Attribute;

/**
 * Picks the fitting routine and prediction mode for a target attribute.
 * <p/>
 * With AUTO a numeric target gets least squares, a two-level nominal target a
 * binomial model and a nominal target with more levels a multinomial model;
 * the robust flag swaps in the outlier-resistant variant, which does not exist
 * for the multinomial case. An explicit family is fitted as a generalized
 * linear model on numeric targets, and on two-level nominal targets when the
 * family is binomial.
 */
public final class ModelSelector {

    private ModelSelector() {
    }

    /**
     * @param target the target attribute
     * @param family the family argument
     * @param robust whether outlier-resistant routines are requested
     * @return the routine to fit and how to read its predictions
     * @throws UnsupportedFamilyException if no routine fits the combination
     */
    public static ModelChoice select(Attribute target, FamilySelector family, boolean robust)
            throws UnsupportedFamilyException {

        if (family == null) {
            throw new UnsupportedFamilyException("Family must be AUTO or a model family");
        }
        if (!target.isNumeric() && !target.isNominal()) {
            throw new UnsupportedFamilyException("Cannot impute " + target.name() + ": only numeric and "
                    + "nominal targets are supported");
        }

        if (!family.isAuto()) {
            return selectExplicit(target, family.getFamily(), robust);
        }

        if (target.isNumeric()) {
            return new ModelChoice(robust ? ModelRoutine.ROBUST_LEAST_SQUARES : ModelRoutine.LEAST_SQUARES,
                    null, PredictionMode.POINT, 0);
        }

        int numLevels = target.numValues();
        if (numLevels < 2) {
            throw new UnsupportedFamilyException("Nominal target " + target.name() + " needs at least two levels");
        }
        if (numLevels == 2) {
            return new ModelChoice(robust ? ModelRoutine.ROBUST_BINOMIAL : ModelRoutine.BINOMIAL,
                    Family.BINOMIAL, PredictionMode.RESPONSE_PROBABILITY, 2);
        }
        if (robust) {
            throw new UnsupportedFamilyException("No robust routine for " + target.name() + ": robust fitting "
                    + "is not available for nominal targets with " + numLevels + " levels");
        }
        return new ModelChoice(ModelRoutine.MULTINOMIAL, null, PredictionMode.CLASS_PROBABILITIES, numLevels);
    }

    private static ModelChoice selectExplicit(Attribute target, Family family, boolean robust)
            throws UnsupportedFamilyException {

        ModelRoutine routine = robust ? ModelRoutine.ROBUST_GLM : ModelRoutine.GLM;

        if (target.isNumeric()) {
            return new ModelChoice(routine, family, PredictionMode.RESPONSE, 0);
        }
        if (family == Family.BINOMIAL && target.numValues() == 2) {
            return new ModelChoice(routine, family, PredictionMode.RESPONSE_PROBABILITY, 2);
        }
        throw new UnsupportedFamilyException("Family " + family + " cannot model nominal target "
                + target.name() + " with " + target.numValues() + " levels");
    }
}

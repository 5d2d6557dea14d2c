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
 *    Formula.java
 *
 */
package regimp.core;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import weka.core.Instances;

/**
 * A model formula of the form <code>T1 + T2 + ... ~ P1 + P2 + ...</code>.
 * The left-hand side lists the target attributes to impute, the right-hand
 * side the predictor attributes shared by all of their models. Both lists keep
 * the order in which the names were written. A target may also be listed as a
 * predictor, which lets later targets use it.
 */
public class Formula implements Serializable {

    static final long serialVersionUID = 3326811047265210311L;

    /** Target attribute names, in formula order */
    private final List<String> m_targets;

    /** Predictor attribute names, in formula order */
    private final List<String> m_predictors;

    private Formula(List<String> targets, List<String> predictors) {
        m_targets = Collections.unmodifiableList(targets);
        m_predictors = Collections.unmodifiableList(predictors);
    }

    /**
     * Parses a formula. Whitespace around and inside the names
     * is removed.
     *
     * @param text formula such as <code>"b1 + b2 ~ x1 + x2"</code>
     * @return the parsed formula
     * @throws InvalidFormulaException if the formula is malformed
     */
    public static Formula parse(String text) throws InvalidFormulaException {

        if (text == null || text.trim().isEmpty()) {
            throw new InvalidFormulaException("No formula given");
        }

        String[] sides = text.split("~", -1);
        if (sides.length != 2) {
            throw new InvalidFormulaException("Formula must contain exactly one '~': " + text);
        }

        List<String> targets = terms(sides[0], "left-hand", text);
        List<String> predictors = terms(sides[1], "right-hand", text);

        return new Formula(targets, predictors);
    }

    private static List<String> terms(String side, String sideName, String text)
            throws InvalidFormulaException {

        if (side.trim().isEmpty()) {
            throw new InvalidFormulaException("The " + sideName + " side of the formula is empty: "
                    + text);
        }

        Set<String> names = new LinkedHashSet<String>();
        for (String term : side.split("\\+", -1)) {
            String name = term.replaceAll("\\s", "");
            if (name.isEmpty()) {
                throw new InvalidFormulaException("Empty term on the " + sideName
                        + " side of the formula: " + text);
            }
            if (!names.add(name)) {
                throw new InvalidFormulaException("Variable " + name + " is repeated on the "
                        + sideName + " side of the formula: " + text);
            }
        }

        return new ArrayList<String>(names);
    }

    /**
     * Checks that every name in the formula is an attribute of the dataset.
     *
     * @param data dataset the formula will be applied to
     * @throws InvalidFormulaException naming the first unknown attribute
     */
    public void validate(Instances data) throws InvalidFormulaException {
        for (String name : m_targets) {
            if (data.attribute(name) == null) {
                throw new InvalidFormulaException("Target variable " + name + " is not an attribute of "
                        + data.relationName());
            }
        }
        for (String name : m_predictors) {
            if (data.attribute(name) == null) {
                throw new InvalidFormulaException("Predictor variable " + name + " is not an attribute of "
                        + data.relationName());
            }
        }
    }

    /**
     * Returns the indices of the predictor attributes in the dataset.
     *
     * @param data dataset the formula has been validated against
     * @return attribute indices, in formula order
     */
    public int[] predictorIndices(Instances data) {
        int[] indices = new int[m_predictors.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = data.attribute(m_predictors.get(i)).index();
        }
        return indices;
    }

    /**
     * Renders the single-target formula used to fit the model of one target.
     *
     * @param target one of the target names
     * @return e.g. <code>"b1 ~ x1 + x2"</code>
     */
    public String forTarget(String target) {
        return target + " ~ " + String.join(" + ", m_predictors);
    }

    public List<String> getTargets() {
        return m_targets;
    }

    public List<String> getPredictors() {
        return m_predictors;
    }

    @Override
    public String toString() {
        return String.join(" + ", m_targets) + " ~ " + String.join(" + ", m_predictors);
    }
}

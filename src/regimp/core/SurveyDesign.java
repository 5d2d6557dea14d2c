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
 *    SurveyDesign.java
 *
 */
package regimp.core;

import java.io.Serializable;
import java.util.Arrays;
import weka.core.Instances;

/**
 * A survey design: the raw table of observed variables together with the
 * per-row sampling weights and strata, and the call that produced the current
 * state of the design.
 */
public class SurveyDesign implements Serializable {

    static final long serialVersionUID = 1932016005713345816L;

    /** The observed variables */
    private Instances m_variables;

    /** Sampling weight of each row */
    private final double[] m_weights;

    /** Stratum id of each row */
    private final int[] m_strata;

    /** Provenance of the design */
    private String m_call;

    /**
     * @param variables raw table
     * @param weights one sampling weight per row
     * @param strata one stratum id per row
     * @param call description of the call that created the design
     */
    public SurveyDesign(Instances variables, double[] weights, int[] strata, String call) {
        if (weights.length != variables.numInstances() || strata.length != variables.numInstances()) {
            throw new IllegalArgumentException("Weights and strata need one entry per row ("
                    + variables.numInstances() + ")");
        }
        m_variables = variables;
        m_weights = Arrays.copyOf(weights, weights.length);
        m_strata = Arrays.copyOf(strata, strata.length);
        m_call = call;
    }

    public Instances getVariables() {
        return m_variables;
    }

    /**
     * Replaces the raw table. Rows are tied to weights and strata, so their
     * number cannot change.
     *
     * @param variables the new table
     */
    public void setVariables(Instances variables) {
        if (variables.numInstances() != m_weights.length) {
            throw new IllegalArgumentException("Design has " + m_weights.length + " rows, table has "
                    + variables.numInstances());
        }
        m_variables = variables;
    }

    public double[] getWeights() {
        return Arrays.copyOf(m_weights, m_weights.length);
    }

    public int[] getStrata() {
        return Arrays.copyOf(m_strata, m_strata.length);
    }

    public String getCall() {
        return m_call;
    }

    public void setCall(String call) {
        m_call = call;
    }
}

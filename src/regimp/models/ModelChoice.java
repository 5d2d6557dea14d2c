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
 *    ModelChoice.java
 *
 */
package regimp.models;

import java.io.Serializable;
import regimp.core.Family;

/**
 * Outcome of model selection for one target attribute: which routine to fit,
 * with which family, and how to read its predictions.
 */
public class ModelChoice implements Serializable {

    static final long serialVersionUID = -1585276040925431129L;

    private final ModelRoutine m_routine;

    /** Family of GLM routines, null otherwise */
    private final Family m_family;

    private final PredictionMode m_predictionMode;

    /** Levels of a nominal target, 0 for a numeric one */
    private final int m_numLevels;

    public ModelChoice(ModelRoutine routine, Family family, PredictionMode predictionMode, int numLevels) {
        m_routine = routine;
        m_family = family;
        m_predictionMode = predictionMode;
        m_numLevels = numLevels;
    }

    public ModelRoutine getRoutine() {
        return m_routine;
    }

    public Family getFamily() {
        return m_family;
    }

    public PredictionMode getPredictionMode() {
        return m_predictionMode;
    }

    public int getNumLevels() {
        return m_numLevels;
    }

    /**
     * @return true if predictions have to be resolved to a level
     */
    public boolean isCategorical() {
        return m_numLevels > 0;
    }

    @Override
    public String toString() {
        return m_routine + (m_family == null ? "" : "(" + m_family + ")") + " -> " + m_predictionMode;
    }
}

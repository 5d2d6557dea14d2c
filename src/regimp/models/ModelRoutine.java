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
 *    ModelRoutine.java
 *
 */
package regimp.models;

/**
 * Fitting routines a {@link ModelBackend} has to provide.
 */
public enum ModelRoutine {

    /** Ordinary least squares */
    LEAST_SQUARES(false),

    /** Outlier-resistant least squares */
    ROBUST_LEAST_SQUARES(true),

    /** Logistic regression for a two-level target */
    BINOMIAL(false),

    /** Outlier-resistant logistic regression */
    ROBUST_BINOMIAL(true),

    /** Softmax regression for a target with more than two levels */
    MULTINOMIAL(false),

    /** Generalized linear model with an explicitly chosen family */
    GLM(false),

    /** Outlier-resistant generalized linear model */
    ROBUST_GLM(true);

    private final boolean m_robust;

    ModelRoutine(boolean robust) {
        m_robust = robust;
    }

    public boolean isRobust() {
        return m_robust;
    }
}

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
 *    Family.java
 *
 */
package regimp.core;

import weka.core.WekaException;

/**
 * Exponential families available for explicitly chosen generalized linear
 * models, each with its canonical link.
 */
public enum Family {

    /** Normal errors, identity link */
    GAUSSIAN("gaussian") {
        @Override
        public double link(double mu) {
            return mu;
        }

        @Override
        public double inverseLink(double eta) {
            return eta;
        }

        @Override
        public double meanDerivative(double eta) {
            return 1.0;
        }

        @Override
        public double variance(double mu) {
            return 1.0;
        }

        @Override
        public double unitDeviance(double y, double mu) {
            return (y - mu) * (y - mu);
        }

        @Override
        public double initialMean(double y) {
            return y;
        }

        @Override
        public void checkResponse(double y) throws WekaException {
            // any finite value
        }
    },

    /** Bernoulli responses in [0,1], logit link */
    BINOMIAL("binomial") {
        @Override
        public double link(double mu) {
            return Math.log(mu / (1.0 - mu));
        }

        @Override
        public double inverseLink(double eta) {
            double mu = 1.0 / (1.0 + Math.exp(-eta));
            return Math.min(Math.max(mu, EPSILON), 1.0 - EPSILON);
        }

        @Override
        public double meanDerivative(double eta) {
            double mu = inverseLink(eta);
            return Math.max(mu * (1.0 - mu), EPSILON);
        }

        @Override
        public double variance(double mu) {
            return Math.max(mu * (1.0 - mu), EPSILON);
        }

        @Override
        public double unitDeviance(double y, double mu) {
            return 2.0 * (yLogY(y, mu) + yLogY(1.0 - y, 1.0 - mu));
        }

        @Override
        public double initialMean(double y) {
            return (y + 0.5) / 2.0;
        }

        @Override
        public void checkResponse(double y) throws WekaException {
            if (y < 0.0 || y > 1.0) {
                throw new WekaException("Binomial response must lie in [0,1], got " + y);
            }
        }
    },

    /** Counts, log link */
    POISSON("poisson") {
        @Override
        public double link(double mu) {
            return Math.log(mu);
        }

        @Override
        public double inverseLink(double eta) {
            return Math.max(Math.exp(Math.min(eta, MAX_ETA)), EPSILON);
        }

        @Override
        public double meanDerivative(double eta) {
            return inverseLink(eta);
        }

        @Override
        public double variance(double mu) {
            return Math.max(mu, EPSILON);
        }

        @Override
        public double unitDeviance(double y, double mu) {
            return 2.0 * (yLogY(y, mu) - (y - mu));
        }

        @Override
        public double initialMean(double y) {
            return y + 0.1;
        }

        @Override
        public void checkResponse(double y) throws WekaException {
            if (y < 0.0) {
                throw new WekaException("Poisson response must be non-negative, got " + y);
            }
        }
    };

    /** Keeps fitted means away from the boundary of their range */
    static final double EPSILON = 1.0e-10;

    /** exp() overflows a little above 709 */
    static final double MAX_ETA = 700.0;

    private final String m_name;

    Family(String name) {
        m_name = name;
    }

    /** g(mu) */
    public abstract double link(double mu);

    /** g^-1(eta) */
    public abstract double inverseLink(double eta);

    /** d mu / d eta evaluated at eta */
    public abstract double meanDerivative(double eta);

    /** V(mu) */
    public abstract double variance(double mu);

    /** Deviance contribution of one observation with weight one */
    public abstract double unitDeviance(double y, double mu);

    /** Starting value of the mean for IRLS */
    public abstract double initialMean(double y);

    /**
     * Rejects responses outside the support of the family.
     *
     * @param y observed response
     * @throws WekaException if y cannot come from this family
     */
    public abstract void checkResponse(double y) throws WekaException;

    /**
     * Name used in options and formulas, e.g. "binomial".
     *
     * @return lower-case family name
     */
    public String getName() {
        return m_name;
    }

    @Override
    public String toString() {
        return m_name;
    }

    /**
     * Looks a family up by name, ignoring case.
     *
     * @param name family name
     * @return the family
     * @throws UnsupportedFamilyException if no family has that name
     */
    public static Family forName(String name) throws UnsupportedFamilyException {
        if (name != null) {
            for (Family family : values()) {
                if (family.m_name.equalsIgnoreCase(name.trim())) {
                    return family;
                }
            }
        }
        throw new UnsupportedFamilyException("Unknown family: " + name);
    }

    static double yLogY(double y, double mu) {
        return y > 0.0 ? y * Math.log(y / mu) : 0.0;
    }
}

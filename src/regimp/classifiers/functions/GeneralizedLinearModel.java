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
 *    GeneralizedLinearModel.java
 *
 */
package regimp.classifiers.functions;

import java.util.Arrays;
import java.util.Collections;
import java.util.Enumeration;
import java.util.Vector;
import regimp.core.Family;
import weka.classifiers.AbstractClassifier;
import weka.core.Capabilities;
import weka.core.Capabilities.Capability;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Option;
import weka.core.Utils;
import weka.core.WeightedInstancesHandler;
import weka.core.WekaException;
import weka.core.matrix.Matrix;
import weka.filters.Filter;
import weka.filters.unsupervised.attribute.NominalToBinary;

/**
 * <!-- globalinfo-start -->
 * Generalized linear model fitted by iteratively reweighted least squares.
 * Nominal attributes are turned into indicator attributes and an intercept is
 * added. In robust mode the working weights are multiplied by Huber weights of
 * the Pearson residuals, which limits the influence of outlying observations.
 * A numeric class is predicted on the response scale; a binary class (binomial
 * family only) gets the distribution {1-p, p}, where p is the probability of
 * the second class value.
 * <p/>
 * <!-- globalinfo-end -->
 *
 * <!-- options-start -->
 * Valid options are:
 * <p/>
 *
 * <pre> -F
 * family - Family of the model: gaussian, binomial or poisson</pre>
 *
 * <pre> -R
 * robust - Use Huber-weighted robust fitting</pre>
 *
 * <pre> -C
 * huberConstant - Tuning constant of the Huber weights</pre>
 *
 * <pre> -I
 * maxIterations - Maximum number of IRLS iterations</pre>
 *
 * <pre> -T
 * tolerance - Relative change of the coefficients at which IRLS stops</pre>
 *
 * <pre> -ridge
 * ridge - Ridge added to the diagonal of the weighted cross-product matrix</pre>
 * <!-- options-end -->
 */
public class GeneralizedLinearModel extends AbstractClassifier implements WeightedInstancesHandler {

    static final long serialVersionUID = 6270113457220940245L;

    /** Huber constant giving 95% efficiency under normal errors */
    public static final double DEFAULT_HUBER_CONSTANT = 1.345;

    public static final int DEFAULT_MAX_ITERATIONS = 200;

    public static final double DEFAULT_TOLERANCE = 1.0e-7;

    /** Scales the median absolute deviation to the normal standard deviation */
    private static final double MAD_CONSISTENCY = 1.4826;

    private Family m_family = Family.GAUSSIAN;

    private boolean m_robust = false;

    private double m_huberConstant = DEFAULT_HUBER_CONSTANT;

    private int m_maxIterations = DEFAULT_MAX_ITERATIONS;

    private double m_tolerance = DEFAULT_TOLERANCE;

    private double m_ridge = 1.0e-8;

    /** Intercept followed by one coefficient per converted attribute */
    private double[] m_coefficients;

    /** Number of IRLS iterations the last fit took */
    private int m_iterations;

    /** Deviance of the fitted model on the training data */
    private double m_deviance;

    /** Whether the class is nominal (binary) */
    private boolean m_nominalClass;

    /** Converts nominal attributes to indicators */
    private NominalToBinary m_nominalToBinary;

    /** Converted training header, for toString() */
    private Instances m_header;

    public GeneralizedLinearModel() {
    }

    public GeneralizedLinearModel(Family family, boolean robust) {
        m_family = family;
        m_robust = robust;
    }

    /**
     * Returns the Capabilities of this classifier.
     *
     * @return the capabilities of this object
     */
    @Override
    public Capabilities getCapabilities() {
        Capabilities result = super.getCapabilities();
        result.disableAll();

        result.enable(Capability.NUMERIC_ATTRIBUTES);
        result.enable(Capability.NOMINAL_ATTRIBUTES);

        result.enable(Capability.NUMERIC_CLASS);
        result.enable(Capability.BINARY_CLASS);
        result.enable(Capability.MISSING_CLASS_VALUES);

        return result;
    }

    /**
     * Fits the model.
     *
     * @param data training data
     * @throws Exception if the data does not suit the family, the system is
     * singular or IRLS does not converge
     */
    @Override
    public void buildClassifier(Instances data) throws Exception {

        getCapabilities().testWithFail(data);

        data = new Instances(data);
        data.deleteWithMissingClass();
        if (data.numInstances() == 0) {
            throw new WekaException("No training instances with a known class value");
        }

        m_nominalClass = data.classAttribute().isNominal();
        if (m_nominalClass && m_family != Family.BINOMIAL) {
            throw new WekaException("Family " + m_family + " needs a numeric class, "
                    + data.classAttribute().name() + " is nominal");
        }

        m_nominalToBinary = new NominalToBinary();
        m_nominalToBinary.setInputFormat(data);
        data = Filter.useFilter(data, m_nominalToBinary);
        m_header = new Instances(data, 0);

        int n = data.numInstances();
        int p = data.numAttributes();
        int classIndex = data.classIndex();

        double[][] x = new double[n][p];
        double[] y = new double[n];
        double[] prior = new double[n];
        for (int i = 0; i < n; i++) {
            Instance inst = data.instance(i);
            x[i][0] = 1.0;
            int col = 1;
            for (int j = 0; j < p; j++) {
                if (j != classIndex) {
                    x[i][col++] = inst.value(j);
                }
            }
            y[i] = inst.classValue();
            prior[i] = inst.weight();
            m_family.checkResponse(y[i]);
        }

        double[] eta = new double[n];
        double[] mu = new double[n];
        for (int i = 0; i < n; i++) {
            mu[i] = m_family.initialMean(y[i]);
            eta[i] = m_family.link(mu[i]);
        }

        double[] beta = null;
        boolean converged = false;
        double[] z = new double[n];
        double[] w = new double[n];
        for (m_iterations = 1; m_iterations <= m_maxIterations; m_iterations++) {

            for (int i = 0; i < n; i++) {
                double d = m_family.meanDerivative(eta[i]);
                z[i] = eta[i] + (y[i] - mu[i]) / d;
                w[i] = prior[i] * d * d / m_family.variance(mu[i]);
            }
            if (m_robust) {
                applyHuberWeights(y, mu, w);
            }

            double[] previous = beta;
            beta = solveWeighted(x, z, w);
            for (int i = 0; i < n; i++) {
                eta[i] = dot(x[i], beta);
                mu[i] = m_family.inverseLink(eta[i]);
            }

            if (previous != null && hasConverged(previous, beta)) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            throw new WekaException("IRLS did not converge in " + m_maxIterations + " iterations");
        }
        m_coefficients = beta;

        m_deviance = 0;
        for (int i = 0; i < n; i++) {
            m_deviance += prior[i] * m_family.unitDeviance(y[i], mu[i]);
        }
    }

    /**
     * Multiplies the working weights by Huber weights of the Pearson
     * residuals. Residuals of the Gaussian family are first scaled by their
     * median absolute deviation.
     */
    private void applyHuberWeights(double[] y, double[] mu, double[] w) {

        double[] residuals = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            residuals[i] = (y[i] - mu[i]) / Math.sqrt(m_family.variance(mu[i]));
        }

        double scale = 1.0;
        if (m_family == Family.GAUSSIAN) {
            scale = MAD_CONSISTENCY * medianAbsoluteDeviation(residuals);
            if (scale <= 0) {
                // more than half of the rows fit exactly
                double largest = 0;
                for (double r : residuals) {
                    largest = Math.max(largest, Math.abs(r));
                }
                if (largest == 0) {
                    return;
                }
                scale = 1.0e-6 * largest;
            }
        }

        for (int i = 0; i < y.length; i++) {
            double r = Math.abs(residuals[i]) / scale;
            if (r > m_huberConstant) {
                w[i] *= m_huberConstant / r;
            }
        }
    }

    private static double medianAbsoluteDeviation(double[] values) {
        double center = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - center);
        }
        return median(deviations);
    }

    private static double median(double[] values) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int half = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[half];
        }
        return (sorted[half - 1] + sorted[half]) / 2.0;
    }

    /**
     * Solves (X'WX + ridge) b = X'Wz. The intercept is not penalised.
     */
    private double[] solveWeighted(double[][] x, double[] z, double[] w) throws WekaException {

        int p = x[0].length;
        double[][] xtwx = new double[p][p];
        double[] xtwz = new double[p];
        for (int i = 0; i < x.length; i++) {
            for (int a = 0; a < p; a++) {
                double xa = x[i][a] * w[i];
                xtwz[a] += xa * z[i];
                for (int b = 0; b < p; b++) {
                    xtwx[a][b] += xa * x[i][b];
                }
            }
        }
        for (int a = 1; a < p; a++) {
            xtwx[a][a] += m_ridge;
        }

        Matrix solution;
        try {
            solution = new Matrix(xtwx).solve(new Matrix(xtwz, p));
        } catch (RuntimeException e) {
            throw new WekaException("Cannot solve the weighted least squares system: " + e.getMessage());
        }

        double[] beta = new double[p];
        for (int a = 0; a < p; a++) {
            beta[a] = solution.get(a, 0);
            if (Double.isNaN(beta[a]) || Double.isInfinite(beta[a])) {
                throw new WekaException("Singular weighted least squares system");
            }
        }
        return beta;
    }

    private boolean hasConverged(double[] previous, double[] current) {
        double change = 0;
        double size = 0;
        for (int a = 0; a < current.length; a++) {
            change = Math.max(change, Math.abs(current[a] - previous[a]));
            size = Math.max(size, Math.abs(previous[a]));
        }
        return change <= m_tolerance * (size + 1.0);
    }

    private static double dot(double[] row, double[] beta) {
        double sum = 0;
        for (int a = 0; a < row.length; a++) {
            sum += row[a] * beta[a];
        }
        return sum;
    }

    /**
     * Predicts the mean of the class on the response scale.
     *
     * @param instance instance with the training header
     * @return {mu} for a numeric class, {1-p, p} for a binary one
     * @throws Exception if the model has not been built
     */
    @Override
    public double[] distributionForInstance(Instance instance) throws Exception {

        if (m_coefficients == null) {
            throw new WekaException("No model built yet");
        }

        m_nominalToBinary.input(instance);
        m_nominalToBinary.batchFinished();
        Instance converted = m_nominalToBinary.output();

        double eta = m_coefficients[0];
        int col = 1;
        for (int j = 0; j < converted.numAttributes(); j++) {
            if (j != converted.classIndex()) {
                eta += m_coefficients[col++] * converted.value(j);
            }
        }

        double mu = m_family.inverseLink(eta);
        if (m_nominalClass) {
            return new double[] {1.0 - mu, mu};
        }
        return new double[] {mu};
    }

    /**
     * @return the intercept followed by the coefficients of the converted
     * attributes, null before the model is built
     */
    public double[] getCoefficients() {
        return m_coefficients == null ? null : Arrays.copyOf(m_coefficients, m_coefficients.length);
    }

    public int getNumIterations() {
        return m_iterations;
    }

    /**
     * @return the weighted sum of the unit deviances of the training rows
     */
    public double getDeviance() {
        return m_deviance;
    }

    @Override
    public String toString() {
        if (m_coefficients == null) {
            return "GeneralizedLinearModel: No model built yet.";
        }
        StringBuilder text = new StringBuilder();
        text.append(m_robust ? "Robust g" : "G").append("eneralized linear model, family ").append(m_family)
                .append("\n\n").append(m_header.classAttribute().name()).append(" =\n\n");
        text.append(Utils.doubleToString(m_coefficients[0], 12, 4)).append("\n");
        int col = 1;
        for (int j = 0; j < m_header.numAttributes(); j++) {
            if (j != m_header.classIndex()) {
                text.append(Utils.doubleToString(m_coefficients[col++], 12, 4)).append(" * ")
                        .append(m_header.attribute(j).name()).append("\n");
            }
        }
        text.append("\nDeviance: ").append(Utils.doubleToString(m_deviance, 4)).append("\n");
        text.append("IRLS iterations: ").append(m_iterations).append("\n");
        return text.toString();
    }

    /**
     * Returns a string describing this classifier.
     *
     * @return a description suitable for displaying in the
     * explorer/experimenter
     */
    public String globalInfo() {
        return "Generalized linear model fitted by iteratively reweighted least squares. "
                + "Nominal attributes are turned into indicator attributes and an intercept is added. "
                + "In robust mode the working weights are multiplied by Huber weights of the Pearson "
                + "residuals, which limits the influence of outlying observations.";
    }

    public Family getFamily() {
        return m_family;
    }

    public void setFamily(Family family) {
        m_family = family;
    }

    public String familyTipText() {
        return "Family of the model: gaussian, binomial or poisson.";
    }

    public boolean getRobust() {
        return m_robust;
    }

    public void setRobust(boolean robust) {
        m_robust = robust;
    }

    public String robustTipText() {
        return "Use Huber-weighted robust fitting.";
    }

    public double getHuberConstant() {
        return m_huberConstant;
    }

    /**
     * @param huberConstant residuals beyond this many scale units are
     * downweighted
     * @throws IllegalArgumentException if the constant is not positive
     */
    public void setHuberConstant(double huberConstant) {
        if (huberConstant <= 0) {
            throw new IllegalArgumentException("Huber constant must be positive");
        }
        m_huberConstant = huberConstant;
    }

    public String huberConstantTipText() {
        return "Tuning constant of the Huber weights.";
    }

    public int getMaxIterations() {
        return m_maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        m_maxIterations = maxIterations;
    }

    public String maxIterationsTipText() {
        return "Maximum number of IRLS iterations.";
    }

    public double getTolerance() {
        return m_tolerance;
    }

    public void setTolerance(double tolerance) {
        m_tolerance = tolerance;
    }

    public String toleranceTipText() {
        return "Relative change of the coefficients at which IRLS stops.";
    }

    public double getRidge() {
        return m_ridge;
    }

    public void setRidge(double ridge) {
        m_ridge = ridge;
    }

    public String ridgeTipText() {
        return "Ridge added to the diagonal of the weighted cross-product matrix.";
    }

    /**
     * Returns an enumeration describing the available options.
     *
     * @return an enumeration of all the available options
     */
    @Override
    public Enumeration<Option> listOptions() {
        Vector<Option> result = new Vector<Option>();

        result.addElement(new Option("\tFamily of the model: gaussian, binomial or poisson.\n"
                + "\t(default gaussian)", "F", 1, "-F <family>"));
        result.addElement(new Option("\tUse Huber-weighted robust fitting.", "R", 0, "-R"));
        result.addElement(new Option("\tTuning constant of the Huber weights.\n"
                + "\t(default " + DEFAULT_HUBER_CONSTANT + ")", "C", 1, "-C <num>"));
        result.addElement(new Option("\tMaximum number of IRLS iterations.\n"
                + "\t(default " + DEFAULT_MAX_ITERATIONS + ")", "I", 1, "-I <num>"));
        result.addElement(new Option("\tRelative change of the coefficients at which IRLS stops.\n"
                + "\t(default " + DEFAULT_TOLERANCE + ")", "T", 1, "-T <num>"));
        result.addElement(new Option("\tRidge added to the diagonal of the cross-product matrix.\n"
                + "\t(default 1e-8)", "ridge", 1, "-ridge <num>"));

        result.addAll(Collections.list(super.listOptions()));

        return result.elements();
    }

    /**
     * Parses a given list of options.
     *
     * @param options the list of options as an array of strings
     * @throws Exception if an option is not supported
     */
    @Override
    public void setOptions(String[] options) throws Exception {
        String optionString;

        optionString = Utils.getOption('F', options);
        setFamily(optionString.length() != 0 ? Family.forName(optionString) : Family.GAUSSIAN);

        setRobust(Utils.getFlag('R', options));

        optionString = Utils.getOption('C', options);
        setHuberConstant(optionString.length() != 0 ? Double.parseDouble(optionString) : DEFAULT_HUBER_CONSTANT);

        optionString = Utils.getOption('I', options);
        setMaxIterations(optionString.length() != 0 ? Integer.parseInt(optionString) : DEFAULT_MAX_ITERATIONS);

        optionString = Utils.getOption('T', options);
        setTolerance(optionString.length() != 0 ? Double.parseDouble(optionString) : DEFAULT_TOLERANCE);

        optionString = Utils.getOption("ridge", options);
        setRidge(optionString.length() != 0 ? Double.parseDouble(optionString) : 1.0e-8);

        super.setOptions(options);

        Utils.checkForRemainingOptions(options);
    }

    /**
     * Gets the current settings of the classifier.
     *
     * @return an array of strings suitable for passing to setOptions()
     */
    @Override
    public String[] getOptions() {
        Vector<String> result = new Vector<String>();

        result.add("-F");
        result.add(getFamily().getName());

        if (getRobust()) {
            result.add("-R");
        }

        result.add("-C");
        result.add("" + getHuberConstant());

        result.add("-I");
        result.add("" + getMaxIterations());

        result.add("-T");
        result.add("" + getTolerance());

        result.add("-ridge");
        result.add("" + getRidge());

        Collections.addAll(result, super.getOptions());

        return result.toArray(new String[result.size()]);
    }

    /**
     * Main method for running this classifier from the command line.
     *
     * @param argv the options
     */
    public static void main(String[] argv) {
        runClassifier(new GeneralizedLinearModel(), argv);
    }
}

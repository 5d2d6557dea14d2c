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
 *    WekaModelBackend.java
 *
 */
package regimp.models;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import regimp.classifiers.functions.GeneralizedLinearModel;
import regimp.core.Family;
import weka.classifiers.Classifier;
import weka.classifiers.functions.LinearRegression;
import weka.classifiers.functions.Logistic;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.SelectedTag;
import weka.filters.Filter;
import weka.filters.unsupervised.attribute.Remove;

/**
 * Backend built on Weka classifiers. Least squares uses
 * {@link LinearRegression} without attribute selection, the binomial and
 * multinomial routines use {@link Logistic}, and the explicit-family and
 * robust routines use {@link GeneralizedLinearModel}.
 */
public class WekaModelBackend implements ModelBackend, Serializable {

    static final long serialVersionUID = -3172830916390416120L;

    /** What to do with the output of the multinomial fit */
    private FitOutput m_fitOutput = FitOutput.DISCARD;

    public WekaModelBackend() {
    }

    public WekaModelBackend(FitOutput fitOutput) {
        m_fitOutput = fitOutput;
    }

    public FitOutput getFitOutput() {
        return m_fitOutput;
    }

    public void setFitOutput(FitOutput fitOutput) {
        m_fitOutput = fitOutput;
    }

    @Override
    public FittedModel fit(ModelChoice choice, String target, List<String> predictors, Instances data)
            throws Exception {

        // keep target and predictors in dataset order
        int[] keep = new int[predictors.size() + 1];
        keep[0] = data.attribute(target).index();
        for (int i = 0; i < predictors.size(); i++) {
            keep[i + 1] = data.attribute(predictors.get(i)).index();
        }
        Arrays.sort(keep);

        Instances training = new Instances(data);
        training.setClassIndex(data.attribute(target).index());

        Remove remove = new Remove();
        remove.setAttributeIndicesArray(keep);
        remove.setInvertSelection(true);
        remove.setInputFormat(training);
        training = Filter.useFilter(training, remove);

        Classifier classifier = createClassifier(choice);
        if (choice.getRoutine() == ModelRoutine.MULTINOMIAL) {
            buildCapturingOutput(classifier, training, target);
        } else {
            classifier.buildClassifier(training);
        }

        return new WekaFittedModel(classifier, remove, data.attribute(target).index());
    }

    /**
     * Creates the untrained classifier for a routine.
     *
     * @param choice the selected routine
     * @return a fresh classifier
     */
    protected Classifier createClassifier(ModelChoice choice) {
        switch (choice.getRoutine()) {
            case LEAST_SQUARES:
                LinearRegression leastSquares = new LinearRegression();
                leastSquares.setAttributeSelectionMethod(
                        new SelectedTag(LinearRegression.SELECTION_NONE, LinearRegression.TAGS_SELECTION));
                leastSquares.setEliminateColinearAttributes(false);
                return leastSquares;
            case ROBUST_LEAST_SQUARES:
                return new GeneralizedLinearModel(Family.GAUSSIAN, true);
            case BINOMIAL:
                return new Logistic();
            case ROBUST_BINOMIAL:
                return new GeneralizedLinearModel(Family.BINOMIAL, true);
            case MULTINOMIAL:
                Logistic multinomial = new Logistic();
                multinomial.setDebug(m_fitOutput == FitOutput.SURFACE);
                return multinomial;
            case GLM:
                return new GeneralizedLinearModel(choice.getFamily(), false);
            case ROBUST_GLM:
                return new GeneralizedLinearModel(choice.getFamily(), true);
            default:
                throw new IllegalArgumentException("Unknown routine " + choice.getRoutine());
        }
    }

    /**
     * Builds the classifier with standard output and error redirected into a
     * buffer, which is then discarded or logged.
     */
    private void buildCapturingOutput(Classifier classifier, Instances training, String target)
            throws Exception {

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8.name());
        PrintStream out = System.out;
        PrintStream err = System.err;
        try {
            System.setOut(capture);
            System.setErr(capture);
            classifier.buildClassifier(training);
        } finally {
            System.setOut(out);
            System.setErr(err);
            capture.close();
        }

        if (m_fitOutput == FitOutput.SURFACE && buffer.size() > 0) {
            Logger.getLogger(WekaModelBackend.class.getName()).log(Level.INFO,
                    "Output of the multinomial fit for {0}:\n{1}",
                    new Object[] {target, buffer.toString(StandardCharsets.UTF_8.name())});
        }
    }

    /**
     * A trained classifier together with the projection of the rows onto the
     * target and predictor attributes.
     */
    static class WekaFittedModel implements FittedModel, Serializable {

        static final long serialVersionUID = 2843309657521700870L;

        private final Classifier m_classifier;

        private final Remove m_remove;

        private final int m_targetIndex;

        WekaFittedModel(Classifier classifier, Remove remove, int targetIndex) {
            m_classifier = classifier;
            m_remove = remove;
            m_targetIndex = targetIndex;
        }

        Classifier getClassifier() {
            return m_classifier;
        }

        @Override
        public double[][] predict(Instances data, PredictionMode mode) throws Exception {

            Instances rows = new Instances(data);
            rows.setClassIndex(m_targetIndex);

            double[][] predictions = new double[rows.numInstances()][];
            for (int i = 0; i < rows.numInstances(); i++) {
                m_remove.input(rows.instance(i));
                m_remove.batchFinished();
                Instance projected = m_remove.output();

                switch (mode) {
                    case POINT:
                    case RESPONSE:
                        predictions[i] = new double[] {m_classifier.classifyInstance(projected)};
                        break;
                    case RESPONSE_PROBABILITY:
                        predictions[i] = new double[] {m_classifier.distributionForInstance(projected)[1]};
                        break;
                    case CLASS_PROBABILITIES:
                        predictions[i] = m_classifier.distributionForInstance(projected);
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown prediction mode " + mode);
                }
            }
            return predictions;
        }
    }
}

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

package regimp.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static regimp.TestData.NA;
import static regimp.TestData.dataset;
import static regimp.TestData.nominal;
import static regimp.TestData.numeric;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.logging.Level;

import org.junit.jupiter.api.Test;

import regimp.LogCapture;
import regimp.TestData;
import regimp.classifiers.functions.GeneralizedLinearModel;
import regimp.core.Family;
import weka.classifiers.functions.LinearRegression;
import weka.classifiers.functions.Logistic;
import weka.core.Attribute;
import weka.core.Instances;

public class WekaModelBackendTest {

    private static final ModelChoice LEAST_SQUARES = new ModelChoice(ModelRoutine.LEAST_SQUARES, null,
            PredictionMode.POINT, 0);

    private static final ModelChoice BINOMIAL = new ModelChoice(ModelRoutine.BINOMIAL, Family.BINOMIAL,
            PredictionMode.RESPONSE_PROBABILITY, 2);

    private static final ModelChoice MULTINOMIAL = new ModelChoice(ModelRoutine.MULTINOMIAL, null,
            PredictionMode.CLASS_PROBABILITIES, 3);

    /** Rows of data where the attribute is present */
    private static Instances observed(Instances data, String attribute) {
        Instances rows = new Instances(data, 0);
        int index = data.attribute(attribute).index();
        for (int i = 0; i < data.numInstances(); i++) {
            if (!data.instance(i).isMissing(index)) {
                rows.add(data.instance(i));
            }
        }
        return rows;
    }

    /** Rows of data at the given positions, with the attribute set to a placeholder */
    private static Instances placeholderRows(Instances data, String attribute, int... positions) {
        Instances rows = new Instances(data, 0);
        for (int position : positions) {
            rows.add(data.instance(position));
        }
        for (int i = 0; i < rows.numInstances(); i++) {
            rows.instance(i).setValue(rows.attribute(attribute), 0);
        }
        return rows;
    }

    @Test
    public void testLeastSquaresIgnoresOtherAttributes() throws Exception {
        Instances data = TestData.numericScenario();
        Instances training = new Instances(data, 0);
        for (int i = 0; i < data.numInstances(); i++) {
            if (!data.instance(i).hasMissingValue()) {
                training.add(data.instance(i));
            }
        }

        FittedModel model = new WekaModelBackend().fit(LEAST_SQUARES, "x1", Arrays.asList("x2", "x3"), training);
        double[][] predictions = model.predict(placeholderRows(data, "x1", 2, 5), PredictionMode.POINT);

        assertEquals(2, predictions.length);
        assertEquals(3 + 2 * 1.0 - 6, predictions[0][0], 1e-4);
        assertEquals(3 + 2 * 2.5 - 1, predictions[1][0], 1e-4);
        assertInstanceOf(LinearRegression.class,
                ((WekaModelBackend.WekaFittedModel) model).getClassifier());
    }

    @Test
    public void testBinomialPredictsProbabilityOfSecondLevel() throws Exception {
        Instances data = TestData.binaryScenario();

        FittedModel model = new WekaModelBackend().fit(BINOMIAL, "b1", Arrays.asList("x1", "x2"),
                observed(data, "b1"));
        double[][] predictions = model.predict(placeholderRows(data, "b1", 0, 19),
                PredictionMode.RESPONSE_PROBABILITY);

        assertEquals(1, predictions[0].length);
        assertTrue(predictions[0][0] < 0.1);
        assertTrue(predictions[1][0] > 0.9);
        assertInstanceOf(Logistic.class, ((WekaModelBackend.WekaFittedModel) model).getClassifier());
    }

    @Test
    public void testMultinomialPredictsOneProbabilityPerLevel() throws Exception {
        Instances data = TestData.multinomialScenario();

        FittedModel model = new WekaModelBackend().fit(MULTINOMIAL, "grp", Arrays.asList("x"),
                observed(data, "grp"));
        double[][] predictions = model.predict(placeholderRows(data, "grp", 0, 29),
                PredictionMode.CLASS_PROBABILITIES);

        for (double[] distribution : predictions) {
            assertEquals(3, distribution.length);
            assertEquals(1.0, distribution[0] + distribution[1] + distribution[2], 1e-9);
        }
        assertTrue(predictions[0][0] > 0.5);
        assertTrue(predictions[1][2] > 0.5);
    }

    @Test
    public void testMultinomialOutputIsCaptured() throws Exception {
        Instances data = TestData.multinomialScenario();
        LogCapture log = LogCapture.attach(WekaModelBackend.class);
        PrintStream out = System.out;
        PrintStream err = System.err;
        ByteArrayOutputStream console = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(console, true));
            System.setErr(new PrintStream(console, true));

            new WekaModelBackend(FitOutput.DISCARD).fit(MULTINOMIAL, "grp", Arrays.asList("x"),
                    observed(data, "grp"));
            assertTrue(log.getRecords().isEmpty());

            new WekaModelBackend(FitOutput.SURFACE).fit(MULTINOMIAL, "grp", Arrays.asList("x"),
                    observed(data, "grp"));
            assertTrue(log.contains(Level.INFO, "Output of the multinomial fit for {0}"));
        } finally {
            System.setOut(out);
            System.setErr(err);
            log.detach();
        }

        assertEquals(0, console.size());
    }

    @Test
    public void testExplicitFamilyUsesGeneralizedLinearModel() throws Exception {
        double[][] rows = new double[10][];
        for (int i = 0; i < 10; i++) {
            rows[i] = new double[] {i, Math.exp(0.5 + 0.2 * i)};
        }
        rows[4][1] = NA;
        Instances data = dataset("counts", new Attribute[] {numeric("x"), numeric("y")}, rows);
        ModelChoice poisson = new ModelChoice(ModelRoutine.GLM, Family.POISSON, PredictionMode.RESPONSE, 0);

        FittedModel model = new WekaModelBackend().fit(poisson, "y", Arrays.asList("x"), observed(data, "y"));
        double[][] predictions = model.predict(placeholderRows(data, "y", 4), PredictionMode.RESPONSE);

        assertEquals(Math.exp(0.5 + 0.2 * 4), predictions[0][0], 1e-4);
        GeneralizedLinearModel glm = (GeneralizedLinearModel) ((WekaModelBackend.WekaFittedModel) model)
                .getClassifier();
        assertEquals(Family.POISSON, glm.getFamily());
        assertFalse(glm.getRobust());
    }

    @Test
    public void testRobustLeastSquaresResistsOutliers() throws Exception {
        double[][] rows = new double[16][];
        for (int i = 0; i < 16; i++) {
            rows[i] = new double[] {i, 2 + i + 0.1 * (((i * 3) % 5) - 2)};
        }
        rows[15][1] = 100;
        rows[7][1] = NA;
        Instances data = dataset("outlier", new Attribute[] {numeric("x"), numeric("y")}, rows);
        ModelChoice robust = new ModelChoice(ModelRoutine.ROBUST_LEAST_SQUARES, null, PredictionMode.POINT, 0);

        double robustPrediction = new WekaModelBackend().fit(robust, "y", Arrays.asList("x"), observed(data, "y"))
                .predict(placeholderRows(data, "y", 7), PredictionMode.POINT)[0][0];
        double ordinaryPrediction = new WekaModelBackend()
                .fit(LEAST_SQUARES, "y", Arrays.asList("x"), observed(data, "y"))
                .predict(placeholderRows(data, "y", 7), PredictionMode.POINT)[0][0];

        assertEquals(9.0, robustPrediction, 0.3);
        assertTrue(Math.abs(ordinaryPrediction - 9.0) > 1.0);
    }

    @Test
    public void testRobustBinomialResistsMislabelledRow() throws Exception {
        // yes for positive x apart from two rows near zero, a "no" far out at x = 15, row 21 to predict
        double[][] rows = new double[22][];
        for (int i = 0; i < 20; i++) {
            double x = i - 9.5;
            double b = x > 0 ? 1 : 0;
            if (i == 8) {
                b = 1;
            } else if (i == 11) {
                b = 0;
            }
            rows[i] = new double[] {x, b};
        }
        rows[20] = new double[] {15, 0};
        rows[21] = new double[] {5, NA};
        Instances data = dataset("mislabelled", new Attribute[] {numeric("x"), nominal("b", "no", "yes")}, rows);
        ModelChoice robust = new ModelChoice(ModelRoutine.ROBUST_BINOMIAL, Family.BINOMIAL,
                PredictionMode.RESPONSE_PROBABILITY, 2);

        FittedModel robustModel = new WekaModelBackend().fit(robust, "b", Arrays.asList("x"), observed(data, "b"));
        double robustProbability = robustModel.predict(placeholderRows(data, "b", 21),
                PredictionMode.RESPONSE_PROBABILITY)[0][0];
        double plainProbability = new WekaModelBackend().fit(BINOMIAL, "b", Arrays.asList("x"), observed(data, "b"))
                .predict(placeholderRows(data, "b", 21), PredictionMode.RESPONSE_PROBABILITY)[0][0];

        assertTrue(robustProbability > 0.95);
        assertTrue(plainProbability < 0.85);
        GeneralizedLinearModel glm = (GeneralizedLinearModel) ((WekaModelBackend.WekaFittedModel) robustModel)
                .getClassifier();
        assertEquals(Family.BINOMIAL, glm.getFamily());
        assertTrue(glm.getRobust());
    }

    @Test
    public void testRobustGlmResistsOutliers() throws Exception {
        double[][] rows = new double[11][];
        for (int i = 0; i < 10; i++) {
            rows[i] = new double[] {i, Math.exp(0.5 + 0.2 * i)};
        }
        rows[5][1] = 50;
        rows[10] = new double[] {5, NA};
        Instances data = dataset("counts", new Attribute[] {numeric("x"), numeric("y")}, rows);
        ModelChoice robust = new ModelChoice(ModelRoutine.ROBUST_GLM, Family.POISSON, PredictionMode.RESPONSE, 0);
        ModelChoice plain = new ModelChoice(ModelRoutine.GLM, Family.POISSON, PredictionMode.RESPONSE, 0);

        double robustPrediction = new WekaModelBackend().fit(robust, "y", Arrays.asList("x"), observed(data, "y"))
                .predict(placeholderRows(data, "y", 10), PredictionMode.RESPONSE)[0][0];
        double plainPrediction = new WekaModelBackend().fit(plain, "y", Arrays.asList("x"), observed(data, "y"))
                .predict(placeholderRows(data, "y", 10), PredictionMode.RESPONSE)[0][0];

        double expected = Math.exp(0.5 + 0.2 * 5);
        assertEquals(expected, robustPrediction, 0.6);
        assertTrue(plainPrediction > expected + 3);
    }

    @Test
    public void testFitWithoutRowsFails() {
        Instances empty = new Instances(TestData.numericScenario(), 0);

        assertThrows(Exception.class,
                () -> new WekaModelBackend().fit(LEAST_SQUARES, "x1", Arrays.asList("x2"), empty));
    }
}

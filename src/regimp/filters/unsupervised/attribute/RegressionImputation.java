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
 *    RegressionImputation.java
 *
 */
package regimp.filters.unsupervised.attribute;

import java.util.Enumeration;
import java.util.Random;
import java.util.Vector;
import java.util.logging.Logger;
import regimp.core.FamilySelector;
import regimp.core.Formula;
import regimp.core.ImputationException;
import regimp.core.ModelFitException;
import regimp.core.SurveyDesign;
import regimp.models.CategoricalDraw;
import regimp.models.FitOutput;
import regimp.models.FittedModel;
import regimp.models.ModelBackend;
import regimp.models.ModelChoice;
import regimp.models.ModelSelector;
import regimp.models.MostLikelyDraw;
import regimp.models.PredictionMode;
import regimp.models.SamplingDraw;
import regimp.models.WekaModelBackend;
import weka.core.Attribute;
import weka.core.Capabilities;
import weka.core.Instances;
import weka.core.Option;
import weka.core.OptionHandler;
import weka.core.Randomizable;
import weka.core.TechnicalInformation;
import weka.core.TechnicalInformationHandler;
import weka.core.Utils;

/**
 * <!-- globalinfo-start -->
 * Imputes missing values of one or more target attributes with regression
 * models. The targets and the predictors are given as a formula
 * "T1 + T2 ~ P1 + P2". For each target in turn a model is fitted on the rows
 * where the target is observed and all predictors are present, and its
 * predictions replace the missing target values of the rows whose predictors
 * are all present. Rows with missing predictors stay missing.
 * <p/>
 * With the family AUTO numeric targets are imputed by least squares, two-level
 * nominal targets by logistic regression and nominal targets with more levels
 * by multinomial logistic regression. Nominal predictions are either the most
 * likely level or a level sampled from the predicted distribution. For every
 * imputed target a TRUE/FALSE attribute &lt;target&gt;_&lt;suffix&gt; records
 * which values were imputed.
 * <p/>
 * <!-- globalinfo-end -->
 *
 * <!-- options-start -->
 * Valid options are:
 * <p/>
 *
 * <pre> -F
 * formula - Targets and predictors, e.g. "b1 + b2 ~ x1 + x2"</pre>
 *
 * <pre> -Y
 * family - AUTO, or gaussian, binomial or poisson for a generalized linear model</pre>
 *
 * <pre> -R
 * robust - Use outlier-resistant fitting routines</pre>
 *
 * <pre> -N
 * no status attributes - Do not create TRUE/FALSE imputation status attributes</pre>
 *
 * <pre> -X
 * imputationSuffix - Suffix of the status attributes</pre>
 *
 * <pre> -M
 * mostLikely - Impute nominal targets with their most likely level instead of sampling</pre>
 *
 * <pre> -S
 * seed - Random number seed for sampling</pre>
 *
 * <pre> -V
 * surfaceFitOutput - Log the output of the multinomial fit instead of discarding it</pre>
 * <!-- options-end -->
 */
public class RegressionImputation extends ModelBasedImputation
        implements OptionHandler, Randomizable, TechnicalInformationHandler {

    static final long serialVersionUID = -8419380726641236377L;

    private static final Logger LOGGER = Logger.getLogger(RegressionImputation.class.getName());

    /** Default suffix of the status attributes */
    public static final String DEFAULT_SUFFIX = "imp";

    /** Targets and predictors */
    private String m_formula = "";

    /** AUTO or an explicit family */
    private FamilySelector m_family = FamilySelector.auto();

    /** Use the robust routines */
    private boolean m_robust = false;

    /** Create TRUE/FALSE status attributes */
    private boolean m_imputationStatus = true;

    /** Suffix of the status attributes */
    private String m_imputationSuffix = DEFAULT_SUFFIX;

    /** Most likely level instead of sampling for nominal targets */
    private boolean m_mostLikely = false;

    /** Seed of the random source used for sampling */
    private int m_Seed = 1;

    /** Random source used for sampling, created from the seed when needed */
    private Random m_random;

    /** Output of the multinomial fit */
    private FitOutput m_fitOutput = FitOutput.DISCARD;

    /** Backend fitting the models, null for the Weka backend */
    private ModelBackend m_backend;

    /**
     * Main method for running this filter.
     *
     * @param argv should contain arguments to the filter: use -h for help
     */
    public static void main(String[] argv) {
        runFilter(new RegressionImputation(), argv);
    }

    /**
     * Imputes the targets of the formula in place. Targets are processed in
     * formula order, so a target sees the values imputed for the targets
     * before it.
     *
     * @param data dataset to impute; status attributes are appended to it
     * @return data
     * @throws Exception if the formula is invalid, a target cannot be modelled
     * with the chosen family, or fitting a model fails
     */
    public Instances impute(Instances data) throws Exception {

        Formula formula = Formula.parse(m_formula);
        formula.validate(data);

        m_dataset = data;
        boolean[] completePredictors = completeRows(formula.predictorIndices(data));
        CategoricalDraw draw = m_mostLikely ? new MostLikelyDraw() : new SamplingDraw(getRandom());
        ModelBackend backend = getModelBackend();

        for (String target : formula.getTargets()) {
            imputeTarget(formula, target, completePredictors, backend, draw);
        }

        return data;
    }

    /**
     * Imputes the variables of a survey design in place and records this call
     * as the design's call. Weights and strata are left alone.
     *
     * @param design design whose variables are imputed
     * @return design
     * @throws Exception as {@link #impute(Instances)}
     */
    public SurveyDesign impute(SurveyDesign design) throws Exception {
        design.setVariables(impute(design.getVariables()));
        design.setCall(getClass().getName() + " " + Utils.joinOptions(getOptions()));
        return design;
    }

    /**
     * Imputes one target attribute of m_dataset.
     */
    protected void imputeTarget(Formula formula, String target, boolean[] completePredictors,
            ModelBackend backend, CategoricalDraw draw) throws Exception {

        Attribute attribute = m_dataset.attribute(target);
        int targetIndex = attribute.index();
        boolean[] missing = missingRows(targetIndex);
        int numMissing = count(missing);

        if (numMissing == 0) {
            LOGGER.info("No missing values in " + target + ".");
            return;
        }

        ModelChoice choice = ModelSelector.select(attribute, m_family, m_robust);

        boolean[] imputeRows = and(missing, completePredictors);
        int numImpute = count(imputeRows);
        if (numImpute == 0) {
            updateImputationStatus(target, missing);
            LOGGER.info("No missing values in " + target + " with valid values in the predictor variables.");
            return;
        }

        Instances fitData = rowsWhere(andNot(missing, completePredictors));
        Instances predictData = rowsWhere(imputeRows);
        // some routines insist on an observed target, its value is not used
        double placeholder = attribute.isNominal() ? 0 : 1;
        for (int i = 0; i < predictData.numInstances(); i++) {
            predictData.instance(i).setValue(targetIndex, placeholder);
        }

        double[][] predictions;
        try {
            FittedModel model = backend.fit(choice, target, formula.getPredictors(), fitData);
            predictions = model.predict(predictData, choice.getPredictionMode());
        } catch (ImputationException e) {
            throw e;
        } catch (Exception e) {
            throw new ModelFitException("Model " + formula.forTarget(target) + " (" + choice + ") failed: "
                    + e.getMessage(), e);
        }

        double[] values = resolve(target, choice, predictions, numImpute, draw);

        updateImputationStatus(target, missing);

        if (numMissing > numImpute) {
            LOGGER.info("There are still missing values in variable " + target
                    + ", probably due to missing values in the predictor variables.");
        }

        int k = 0;
        for (int i = 0; i < imputeRows.length; i++) {
            if (imputeRows[i]) {
                m_dataset.instance(i).setValue(targetIndex, values[k++]);
            }
        }
    }

    /**
     * Records the pre-imputation missingness of a target in its status
     * attribute, if status attributes are enabled.
     */
    private void updateImputationStatus(String target, boolean[] missing) {
        if (m_imputationStatus) {
            String statusName = statusName(target);
            if (markImputationStatus(statusName, missing)) {
                LOGGER.warning("The following imputation status variables will be updated: " + statusName);
            }
        }
    }

    /**
     * Turns model predictions into the values written into the target:
     * numeric predictions as they are, nominal ones resolved to a level index
     * by the draw policy.
     */
    private double[] resolve(String target, ModelChoice choice, double[][] predictions, int numRows,
            CategoricalDraw draw) throws ModelFitException {

        if (predictions == null || predictions.length != numRows) {
            throw new ModelFitException("Model of " + target + " returned "
                    + (predictions == null ? "no" : "" + predictions.length) + " predictions for " + numRows + " rows");
        }

        double[] values = new double[numRows];
        for (int i = 0; i < numRows; i++) {
            double[] prediction = predictions[i];
            if (!choice.isCategorical()) {
                if (Double.isNaN(prediction[0]) || Double.isInfinite(prediction[0])) {
                    throw new ModelFitException("Model of " + target + " predicted " + prediction[0]);
                }
                values[i] = prediction[0];
            } else if (choice.getPredictionMode() == PredictionMode.RESPONSE_PROBABILITY) {
                values[i] = draw.draw(CategoricalDraw.binary(prediction[0]));
            } else {
                values[i] = draw.draw(prediction);
            }
        }
        return values;
    }

    /**
     * @param target target attribute name
     * @return name of its status attribute
     */
    public String statusName(String target) {
        return target + "_" + m_imputationSuffix;
    }

    /**
     * Determines the output format based on the input format: the status
     * attributes of all targets with missing values are added.
     *
     * @param inputFormat the input format to base the output format on
     * @return the output format
     * @throws Exception if the formula does not fit the input format
     */
    @Override
    protected Instances determineOutputFormat(Instances inputFormat) throws Exception {

        Formula formula = Formula.parse(m_formula);
        formula.validate(inputFormat);

        Instances result = new Instances(inputFormat, 0);
        if (m_imputationStatus) {
            for (String target : formula.getTargets()) {
                if (inputFormat.attributeStats(inputFormat.attribute(target).index()).missingCount > 0) {
                    ensureStatusAttribute(result, statusName(target));
                }
            }
        }
        return result;
    }

    @Override
    protected boolean hasImmediateOutputFormat() {
        return true;
    }

    /**
     * Imputes a copy of the input.
     *
     * @param input dataset to process
     * @return imputed dataset
     * @throws Exception if imputation fails
     */
    @Override
    protected Instances process(Instances input) throws Exception {

        Instances result = impute(new Instances(input));

        // the batch may differ in which targets have missing values
        if (!result.equalHeaders(outputFormatPeek())) {
            setOutputFormat(new Instances(result, 0));
        }
        return result;
    }

    /**
     * Sets the format of the input instances.
     *
     * @param instanceInfo an Instances object containing the input instance
     * structure
     * @return true if the outputFormat may be collected immediately
     * @throws Exception if the input format can't be set successfully
     */
    @Override
    public boolean setInputFormat(Instances instanceInfo) throws Exception {

        super.setInputFormat(instanceInfo);
        setOutputFormat(determineOutputFormat(instanceInfo));
        return true;
    }

    /**
     * Returns the Capabilities of this filter.
     *
     * @return the capabilities of this object
     * @see Capabilities
     */
    @Override
    public Capabilities getCapabilities() {
        Capabilities result = super.getCapabilities();
        result.disableAll();

        // attributes
        result.enable(Capabilities.Capability.NUMERIC_ATTRIBUTES);
        result.enable(Capabilities.Capability.NOMINAL_ATTRIBUTES);
        result.enable(Capabilities.Capability.MISSING_VALUES);

        // class
        result.enable(Capabilities.Capability.NOMINAL_CLASS);
        result.enable(Capabilities.Capability.BINARY_CLASS);
        result.enable(Capabilities.Capability.NUMERIC_CLASS);
        result.enable(Capabilities.Capability.MISSING_CLASS_VALUES);
        result.enable(Capabilities.Capability.NO_CLASS);

        return result;
    }

    /**
     * Returns the random source used for sampling nominal targets. Unless one
     * was set, it is created from the seed on first use and then kept, so
     * consecutive imputations draw different values.
     *
     * @return the random source
     */
    public Random getRandom() {
        if (m_random == null) {
            m_random = new Random(m_Seed);
        }
        return m_random;
    }

    /**
     * @param random random source used for sampling, owned by the caller
     */
    public void setRandom(Random random) {
        m_random = random;
    }

    @Override
    public int getSeed() {
        return m_Seed;
    }

    /**
     * Sets the seed and discards the current random source.
     *
     * @param seed the new seed
     */
    @Override
    public void setSeed(int seed) {
        m_Seed = seed;
        m_random = null;
    }

    public String seedTipText() {
        return "Random number seed for sampling nominal targets.";
    }

    public String getFormula() {
        return m_formula;
    }

    public void setFormula(String formula) {
        m_formula = formula;
    }

    public String formulaTipText() {
        return "Targets and predictors, e.g. \"b1 + b2 ~ x1 + x2\".";
    }

    /**
     * @return "AUTO" or the name of the explicit family
     */
    public String getFamily() {
        return m_family.toString();
    }

    /**
     * @param family "AUTO" or the name of a family
     * @throws Exception if the name is neither
     */
    public void setFamily(String family) throws Exception {
        m_family = FamilySelector.forName(family);
    }

    public String familyTipText() {
        return "AUTO chooses the model from the type of each target; gaussian, binomial or poisson "
                + "fits a generalized linear model of that family.";
    }

    public FamilySelector getFamilySelector() {
        return m_family;
    }

    public void setFamilySelector(FamilySelector family) {
        m_family = family;
    }

    public boolean getRobust() {
        return m_robust;
    }

    public void setRobust(boolean robust) {
        m_robust = robust;
    }

    public String robustTipText() {
        return "Use outlier-resistant fitting routines. Not available for nominal targets with more "
                + "than two levels.";
    }

    public boolean getImputationStatus() {
        return m_imputationStatus;
    }

    public void setImputationStatus(boolean imputationStatus) {
        m_imputationStatus = imputationStatus;
    }

    public String imputationStatusTipText() {
        return "Create a TRUE/FALSE attribute per imputed target showing which values were imputed.";
    }

    public String getImputationSuffix() {
        return m_imputationSuffix;
    }

    public void setImputationSuffix(String imputationSuffix) {
        m_imputationSuffix = imputationSuffix;
    }

    public String imputationSuffixTipText() {
        return "Suffix of the status attributes, which are named <target>_<suffix>.";
    }

    public boolean getMostLikely() {
        return m_mostLikely;
    }

    public void setMostLikely(boolean mostLikely) {
        m_mostLikely = mostLikely;
    }

    public String mostLikelyTipText() {
        return "Impute nominal targets with the level of highest predicted probability instead of "
                + "sampling a level from the predicted probabilities.";
    }

    public boolean getSurfaceFitOutput() {
        return m_fitOutput == FitOutput.SURFACE;
    }

    public void setSurfaceFitOutput(boolean surface) {
        m_fitOutput = surface ? FitOutput.SURFACE : FitOutput.DISCARD;
    }

    public String surfaceFitOutputTipText() {
        return "Log the output of the multinomial fit instead of discarding it.";
    }

    /**
     * @return the backend fitting the models
     */
    public ModelBackend getModelBackend() {
        if (m_backend == null) {
            return new WekaModelBackend(m_fitOutput);
        }
        return m_backend;
    }

    /**
     * @param backend backend fitting the models, null for the Weka backend
     */
    public void setModelBackend(ModelBackend backend) {
        m_backend = backend;
    }

    /**
     * Returns an enumeration describing the available options.
     *
     * @return an enumeration of all the available options
     */
    @Override
    public Enumeration<Option> listOptions() {
        Vector<Option> result = new Vector<Option>();

        result.addElement(new Option("\tTargets and predictors, e.g. \"b1 + b2 ~ x1 + x2\".",
                "F", 1, "-F <formula>"));
        result.addElement(new Option("\tAUTO, or gaussian, binomial or poisson.\n\t(default AUTO)",
                "Y", 1, "-Y <family>"));
        result.addElement(new Option("\tUse outlier-resistant fitting routines.", "R", 0, "-R"));
        result.addElement(new Option("\tDo not create TRUE/FALSE imputation status attributes.",
                "N", 0, "-N"));
        result.addElement(new Option("\tSuffix of the status attributes.\n\t(default " + DEFAULT_SUFFIX + ")",
                "X", 1, "-X <suffix>"));
        result.addElement(new Option("\tImpute nominal targets with their most likely level.",
                "M", 0, "-M"));
        result.addElement(new Option("\tRandom number seed for sampling.\n\t(default 1)",
                "S", 1, "-S <num>"));
        result.addElement(new Option("\tLog the output of the multinomial fit.", "V", 0, "-V"));

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

        setFormula(Utils.getOption('F', options));

        optionString = Utils.getOption('Y', options);
        setFamily(optionString.length() != 0 ? optionString : FamilySelector.AUTO_NAME);

        setRobust(Utils.getFlag('R', options));

        setImputationStatus(!Utils.getFlag('N', options));

        optionString = Utils.getOption('X', options);
        setImputationSuffix(optionString.length() != 0 ? optionString : DEFAULT_SUFFIX);

        setMostLikely(Utils.getFlag('M', options));

        optionString = Utils.getOption('S', options);
        setSeed(optionString.length() != 0 ? Integer.parseInt(optionString) : 1);

        setSurfaceFitOutput(Utils.getFlag('V', options));

        Utils.checkForRemainingOptions(options);
    }

    /**
     * Gets the current settings of the filter.
     *
     * @return an array of strings suitable for passing to setOptions()
     */
    @Override
    public String[] getOptions() {

        Vector<String> result = new Vector<String>();

        result.add("-F");
        result.add(getFormula());

        result.add("-Y");
        result.add(getFamily());

        if (getRobust()) {
            result.add("-R");
        }

        if (!getImputationStatus()) {
            result.add("-N");
        }

        result.add("-X");
        result.add(getImputationSuffix());

        if (getMostLikely()) {
            result.add("-M");
        }

        result.add("-S");
        result.add("" + getSeed());

        if (getSurfaceFitOutput()) {
            result.add("-V");
        }

        return result.toArray(new String[result.size()]);
    }

    /**
     * Returns an instance of a TechnicalInformation object, containing detailed
     * information about the technical background of this class, e.g., paper
     * reference or book this class is based on.
     *
     * @return the technical information about this class
     */
    @Override
    public TechnicalInformation getTechnicalInformation() {
        TechnicalInformation result;

        result = new TechnicalInformation(TechnicalInformation.Type.ARTICLE);
        result.setValue(TechnicalInformation.Field.AUTHOR, "Kowarik, A. & Templ, M.");
        result.setValue(TechnicalInformation.Field.YEAR, "2016");
        result.setValue(TechnicalInformation.Field.TITLE, "Imputation with the R Package VIM");
        result.setValue(TechnicalInformation.Field.JOURNAL, "Journal of Statistical Software");
        result.setValue(TechnicalInformation.Field.VOLUME, "74");
        result.setValue(TechnicalInformation.Field.NUMBER, "7");
        result.setValue(TechnicalInformation.Field.PAGES, "1-16");

        return result;
    }

    /**
     * Return a description suitable for displaying in the
     * explorer/experimenter.
     *
     * @return a description suitable for displaying in the
     * explorer/experimenter
     */
    @Override
    public String globalInfo() {

        return "Imputes missing values of one or more target attributes with regression models. "
                + "The targets and the predictors are given as a formula \"T1 + T2 ~ P1 + P2\". "
                + "For each target in turn a model is fitted on the rows where the target is observed "
                + "and all predictors are present, and its predictions replace the missing target "
                + "values of the rows whose predictors are all present. Rows with missing predictors "
                + "stay missing.\n"
                + "\n"
                + "With the family AUTO numeric targets are imputed by least squares, two-level nominal "
                + "targets by logistic regression and nominal targets with more levels by multinomial "
                + "logistic regression. Nominal predictions are either the most likely level or a level "
                + "sampled from the predicted distribution. For every imputed target a TRUE/FALSE "
                + "attribute <target>_<suffix> records which values were imputed.\n\n"
                + "For more information see:\n" + getTechnicalInformation().toString();
    }
}

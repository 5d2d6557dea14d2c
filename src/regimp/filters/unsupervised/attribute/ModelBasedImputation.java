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
 *    ModelBasedImputation.java
 *
 */
package regimp.filters.unsupervised.attribute;

import java.util.Arrays;
import weka.core.Attribute;
import weka.core.Instances;
import weka.filters.SimpleBatchFilter;
import weka.filters.UnsupervisedFilter;

/**
 <!-- globalinfo-start -->
 * Parent class for imputation techniques that fit a model of each attribute
 * to impute on rows where it is observed and predict it where it is missing.
 * Keeps track of which cells were imputed in TRUE/FALSE status attributes.
 * <p/>
 <!-- globalinfo-end -->
 */
public abstract class ModelBasedImputation extends SimpleBatchFilter implements UnsupervisedFilter {

    static final long serialVersionUID = -6329451070233710529L;

    /** Status value of a cell that was observed */
    public static final String STATUS_FALSE = "false";

    /** Status value of a cell that was missing before imputation */
    public static final String STATUS_TRUE = "true";

    /** Dataset to be imputed, modified in place */
    protected Instances m_dataset;

    /**
     * Finds the rows in which none of the given attributes is missing.
     *
     * @param attributeIndices attributes to check
     * @return one flag per row of m_dataset
     */
    protected boolean[] completeRows(int[] attributeIndices) {

        boolean[] complete = new boolean[m_dataset.numInstances()];
        for (int i = 0; i < complete.length; i++) {
            complete[i] = true;
            for (int index : attributeIndices) {
                if (m_dataset.instance(i).isMissing(index)) {
                    complete[i] = false;
                    break;
                }
            }
        }
        return complete;
    }

    /**
     * @param attIndex attribute to check
     * @return one flag per row of m_dataset, true where the value is missing
     */
    protected boolean[] missingRows(int attIndex) {
        boolean[] missing = new boolean[m_dataset.numInstances()];
        for (int i = 0; i < missing.length; i++) {
            missing[i] = m_dataset.instance(i).isMissing(attIndex);
        }
        return missing;
    }

    /**
     * Returns copies of the selected rows of m_dataset, with its header.
     *
     * @param mask one flag per row
     * @return the rows whose flag is set, in dataset order
     */
    protected Instances rowsWhere(boolean[] mask) {
        Instances subDs = new Instances(m_dataset, count(mask));
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                subDs.add(m_dataset.instance(i));
            }
        }
        return subDs;
    }

    /**
     * Writes the pre-imputation missingness of an attribute into its status
     * attribute, creating the status attribute if necessary.
     *
     * @param statusName name of the status attribute
     * @param missing one flag per row of m_dataset
     * @return true if the status attribute existed before
     */
    protected boolean markImputationStatus(String statusName, boolean[] missing) {

        boolean existed = ensureStatusAttribute(m_dataset, statusName);
        int index = m_dataset.attribute(statusName).index();
        for (int i = 0; i < missing.length; i++) {
            m_dataset.instance(i).setValue(index, missing[i] ? 1 : 0);
        }
        return existed;
    }

    /**
     * Makes sure a status attribute of the given name exists. A new one is
     * appended; an existing attribute of another type is replaced, at the same
     * position, by a status attribute with all values missing.
     *
     * @param data dataset or header to change
     * @param statusName name of the status attribute
     * @return true if an attribute with that name existed before
     */
    protected static boolean ensureStatusAttribute(Instances data, String statusName) {

        Attribute existing = data.attribute(statusName);
        if (existing == null) {
            data.insertAttributeAt(statusAttribute(statusName), data.numAttributes());
            return false;
        }

        if (!isStatusAttribute(existing)) {
            int index = existing.index();
            int classIndex = data.classIndex();
            data.setClassIndex(-1);
            data.deleteAttributeAt(index);
            data.insertAttributeAt(statusAttribute(statusName), index);
            data.setClassIndex(classIndex);
        }
        return true;
    }

    /**
     * @param name attribute name
     * @return a new nominal attribute with the values false and true
     */
    public static Attribute statusAttribute(String name) {
        return new Attribute(name, Arrays.asList(STATUS_FALSE, STATUS_TRUE));
    }

    /**
     * @param attribute attribute to check
     * @return true if the attribute is nominal with the values false and true
     */
    public static boolean isStatusAttribute(Attribute attribute) {
        return attribute.isNominal() && attribute.numValues() == 2
                && STATUS_FALSE.equals(attribute.value(0)) && STATUS_TRUE.equals(attribute.value(1));
    }

    protected static int count(boolean[] mask) {
        int count = 0;
        for (boolean b : mask) {
            if (b) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return element-wise a AND b
     */
    protected static boolean[] and(boolean[] a, boolean[] b) {
        boolean[] result = new boolean[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = a[i] && b[i];
        }
        return result;
    }

    /**
     * @return element-wise (NOT a) AND b
     */
    protected static boolean[] andNot(boolean[] a, boolean[] b) {
        boolean[] result = new boolean[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = !a[i] && b[i];
        }
        return result;
    }
}

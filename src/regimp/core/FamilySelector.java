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
 *    FamilySelector.java
 *
 */
package regimp.core;

import java.io.Serializable;

/**
 * Family argument of an imputation: either AUTO, which picks the model from
 * the type of each target attribute, or one explicit {@link Family} used for
 * every target.
 */
public final class FamilySelector implements Serializable {

    static final long serialVersionUID = -7430861950214477392L;

    /** Name of the automatic selection */
    public static final String AUTO_NAME = "AUTO";

    private static final FamilySelector AUTO = new FamilySelector(null);

    /** null for AUTO */
    private final Family m_family;

    private FamilySelector(Family family) {
        m_family = family;
    }

    public static FamilySelector auto() {
        return AUTO;
    }

    public static FamilySelector explicit(Family family) {
        if (family == null) {
            throw new IllegalArgumentException("An explicit family selector needs a family");
        }
        return new FamilySelector(family);
    }

    /**
     * Parses "AUTO" or the name of a family.
     *
     * @param name selector name
     * @return the selector
     * @throws UnsupportedFamilyException if the name is neither
     */
    public static FamilySelector forName(String name) throws UnsupportedFamilyException {
        if (name != null && AUTO_NAME.equals(name.trim())) {
            return AUTO;
        }
        return explicit(Family.forName(name));
    }

    public boolean isAuto() {
        return m_family == null;
    }

    /**
     * @return the explicit family, null for AUTO
     */
    public Family getFamily() {
        return m_family;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FamilySelector)) {
            return false;
        }
        return m_family == ((FamilySelector) o).m_family;
    }

    @Override
    public int hashCode() {
        return m_family == null ? 0 : m_family.hashCode();
    }

    @Override
    public String toString() {
        return isAuto() ? AUTO_NAME : m_family.getName();
    }
}

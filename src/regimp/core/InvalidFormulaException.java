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
 *    InvalidFormulaException.java
 *
 */
package regimp.core;

/**
 * Thrown when a model formula is malformed or names an attribute that the
 * dataset does not have. Raised before any model is fitted.
 */
public class InvalidFormulaException extends ImputationException {

    static final long serialVersionUID = -2650177301965414418L;

    public InvalidFormulaException(String message) {
        super(message);
    }
}

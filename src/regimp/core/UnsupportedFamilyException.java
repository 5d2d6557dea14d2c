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
 *    UnsupportedFamilyException.java
 *
 */
package regimp.core;

/**
 * Thrown when the family argument is not valid or cannot be combined with the
 * type of the target attribute (e.g. a robust multinomial fit).
 */
public class UnsupportedFamilyException extends ImputationException {

    static final long serialVersionUID = 8795308744517015022L;

    public UnsupportedFamilyException(String message) {
        super(message);
    }
}

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
 *    ImputationException.java
 *
 */
package regimp.core;

import weka.core.WekaException;

/**
 * Base class of the errors raised while imputing a dataset. All of them are
 * fatal for the imputation call that raised them.
 */
public class ImputationException extends WekaException {

    static final long serialVersionUID = 4107736915052871460L;

    public ImputationException(String message) {
        super(message);
    }

    public ImputationException(String message, Throwable cause) {
        super(message);
        initCause(cause);
    }
}

// ******************************************************************************
//
// Title:       QuadX.
// Description: QuadX - Adaptive Quadrature over Infinite Domains.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2025.
//
// This file is part of QuadX.
//
// QuadX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// QuadX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// QuadX; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package quadx.numerics.integrate;

/**
 * Termination status of an adaptive quadrature. Every status other than SUCCESS still carries the
 * best available estimate of the integral; the caller decides whether a degraded answer is
 * acceptable.
 *
 * <p>The ordinal codes follow the QUADPACK <code>ier</code> convention of the qagi routine.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum QuadratureStatus {

  /** The requested accuracy was achieved. */
  SUCCESS(0, "requested accuracy achieved"),
  /** The maximum number of subintervals was reached before convergence. */
  MAX_SUBDIVISIONS_REACHED(1, "maximum number of subdivisions reached"),
  /** Roundoff error prevents the requested tolerance from being achieved. */
  ROUNDOFF_LIMITED(2, "roundoff error prevents the requested tolerance"),
  /** Extremely bad integrand behaviour (e.g. a singularity) occurs at some points. */
  BAD_INTEGRAND_BEHAVIOR(3, "extremely bad integrand behavior detected"),
  /** The extrapolated results no longer improve. */
  EXTRAPOLATION_STALLED(4, "extrapolation does not converge"),
  /** The integral is probably divergent or converges too slowly. */
  PROBABLY_DIVERGENT(5, "integral is probably divergent or slowly convergent"),
  /** The requested tolerances or the subinterval limit are invalid. */
  INPUT_INVALID(6, "invalid input");

  private final int code;
  private final String description;

  QuadratureStatus(int code, String description) {
    this.code = code;
    this.description = description;
  }

  /**
   * Look up the status for a QUADPACK error code.
   *
   * @param code The error code (0 through 6).
   * @return The corresponding status.
   */
  public static QuadratureStatus fromCode(int code) {
    for (QuadratureStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException(" Unknown quadrature error code: " + code);
  }

  /**
   * The QUADPACK error code.
   *
   * @return the code.
   */
  public int getCode() {
    return code;
  }

  /**
   * A short human readable description.
   *
   * @return the description.
   */
  public String getDescription() {
    return description;
  }

  /**
   * True only for SUCCESS.
   *
   * @return whether the requested accuracy was achieved.
   */
  public boolean isSuccess() {
    return this == SUCCESS;
  }
}

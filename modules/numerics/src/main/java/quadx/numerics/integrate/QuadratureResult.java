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

import static java.lang.String.format;

/**
 * The outcome of one adaptive quadrature: the best estimate of the integral, its absolute error
 * bound, the work performed and the termination status. Instances are immutable.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class QuadratureResult {

  private final double value;
  private final double error;
  private final int evaluations;
  private final int subintervals;
  private final QuadratureStatus status;

  /**
   * Constructor for QuadratureResult.
   *
   * @param value Estimate of the integral.
   * @param error Estimate of the absolute error, which should bound |integral - value|.
   * @param evaluations Number of integrand evaluations.
   * @param subintervals Number of subintervals produced by the bisection.
   * @param status Termination status.
   */
  public QuadratureResult(double value, double error, int evaluations, int subintervals,
      QuadratureStatus status) {
    this.value = value;
    this.error = error;
    this.evaluations = evaluations;
    this.subintervals = subintervals;
    this.status = status;
  }

  public double getValue() {
    return value;
  }

  public double getError() {
    return error;
  }

  public int getEvaluations() {
    return evaluations;
  }

  public int getSubintervals() {
    return subintervals;
  }

  public QuadratureStatus getStatus() {
    return status;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" %20.14e +/- %10.4e (%d evaluations, %d subintervals, %s)",
        value, error, evaluations, subintervals, status);
  }
}

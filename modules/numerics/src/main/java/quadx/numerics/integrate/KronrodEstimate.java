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
 * The result of applying the 15-point Kronrod rule to one subinterval.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class KronrodEstimate {

  /** Kronrod approximation to the integral over the subinterval. */
  private final double area;
  /** Estimate of the absolute error of the area. */
  private final double absoluteError;
  /** Approximation to the integral of |f|. */
  private final double absoluteArea;
  /** Approximation to the integral of |f - mean(f)|. */
  private final double meanDeviation;

  /**
   * Constructor for KronrodEstimate.
   *
   * @param area Kronrod approximation to the integral.
   * @param absoluteError Estimate of the absolute error.
   * @param absoluteArea Approximation to the integral of |f|.
   * @param meanDeviation Approximation to the integral of |f - mean(f)|.
   */
  public KronrodEstimate(double area, double absoluteError, double absoluteArea,
      double meanDeviation) {
    this.area = area;
    this.absoluteError = absoluteError;
    this.absoluteArea = absoluteArea;
    this.meanDeviation = meanDeviation;
  }

  public double getArea() {
    return area;
  }

  public double getAbsoluteError() {
    return absoluteError;
  }

  /**
   * The QUADPACK <code>resabs</code> value.
   *
   * @return approximation to the integral of |f|.
   */
  public double getAbsoluteArea() {
    return absoluteArea;
  }

  /**
   * The QUADPACK <code>resasc</code> value.
   *
   * @return approximation to the integral of |f - mean(f)|.
   */
  public double getMeanDeviation() {
    return meanDeviation;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Area %16.10e Error %10.4e |f| %10.4e |f-mean| %10.4e",
        area, absoluteError, absoluteArea, meanDeviation);
  }
}

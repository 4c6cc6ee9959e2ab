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

import static java.lang.Double.isInfinite;
import static java.lang.Double.isNaN;
import static java.lang.String.format;

import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * An integration domain with at least one infinite end. Each domain maps the transformed variable
 * t in (0,1] onto the original variable through x = bound + sign * (1 - t) / t, so that an
 * integrand over the infinite domain becomes f(x(t)) / t^2 over (0,1].
 *
 * <p>For the two-sided domain the anchor bound is 0 and the half-lines (-inf,0) and (0,+inf) are
 * folded onto the same transformed coordinate by evaluating f(x) + f(-x).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum InfiniteDomain {

  /** The interval (-inf, b]. */
  LOWER_INFINITE(-1),
  /** The interval [a, +inf). */
  UPPER_INFINITE(1),
  /** The interval (-inf, +inf). */
  BOTH_INFINITE(2);

  /** QUADPACK domain code (-1, 1 or 2). */
  private final int inf;
  /** Orientation of the transform; -1 for the lower-infinite domain, otherwise 1. */
  private final double sign;

  InfiniteDomain(int inf) {
    this.inf = inf;
    this.sign = Math.min(1, inf);
  }

  /**
   * Classify a pair of integration bounds.
   *
   * @param a Lower bound (finite or negative infinity).
   * @param b Upper bound (finite or positive infinity).
   * @return The domain.
   * @throws IllegalArgumentException if either bound is NaN, both are finite, or an infinite bound
   *     has the wrong orientation.
   */
  public static InfiniteDomain of(double a, double b) {
    if (isNaN(a) || isNaN(b)) {
      throw new IllegalArgumentException(format(" Integration bounds must not be NaN: [%s, %s].", a, b));
    }
    if (a == Double.POSITIVE_INFINITY || b == Double.NEGATIVE_INFINITY) {
      throw new IllegalArgumentException(
          format(" Integration bounds are reversed: [%s, %s].", a, b));
    }
    if (isInfinite(a) && isInfinite(b)) {
      return BOTH_INFINITE;
    } else if (isInfinite(a)) {
      return LOWER_INFINITE;
    } else if (isInfinite(b)) {
      return UPPER_INFINITE;
    }
    throw new IllegalArgumentException(
        format(" At least one integration bound must be infinite: [%s, %s].", a, b));
  }

  /**
   * The finite anchor of the transform for the given bounds.
   *
   * @param a Lower bound.
   * @param b Upper bound.
   * @return b for a lower-infinite domain, a for an upper-infinite domain and 0 otherwise.
   */
  public double anchor(double a, double b) {
    switch (this) {
      case LOWER_INFINITE:
        return b;
      case UPPER_INFINITE:
        return a;
      default:
        return 0.0;
    }
  }

  /**
   * Map a transformed coordinate back onto the original domain.
   *
   * @param bound The finite anchor.
   * @param t Transformed coordinate in (0,1].
   * @return x(t).
   */
  public double toX(double bound, double t) {
    return bound + sign * (1.0 - t) / t;
  }

  /**
   * Map a point of the original domain onto the transformed coordinate. For the two-sided domain
   * the absolute value of x is used.
   *
   * @param bound The finite anchor.
   * @param x A point of the domain.
   * @return t(x) in (0,1].
   */
  public double toT(double bound, double x) {
    double d = sign * (x - bound);
    if (this == BOTH_INFINITE) {
      d = Math.abs(x);
    }
    return 1.0 / (1.0 + d);
  }

  /**
   * Evaluate the integrand at the point x(t), folding both half-lines for the two-sided domain. The
   * Jacobian 1/t^2 is not applied.
   *
   * @param function The integrand.
   * @param bound The finite anchor.
   * @param t Transformed coordinate in (0,1].
   * @return f(x(t)), or f(x(t)) + f(-x(t)) for the two-sided domain.
   */
  public double evaluate(UnivariateFunction function, double bound, double t) {
    double x = toX(bound, t);
    double value = function.value(x);
    if (this == BOTH_INFINITE) {
      value += function.value(-x);
    }
    return value;
  }

  /**
   * Integrand evaluations made for each transformed abscissa.
   *
   * @return 2 for the two-sided domain, otherwise 1.
   */
  public int evaluationsPerPoint() {
    return this == BOTH_INFINITE ? 2 : 1;
  }

  /**
   * The QUADPACK <code>inf</code> code of this domain.
   *
   * @return -1, 1 or 2.
   */
  public int getCode() {
    return inf;
  }
}

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

import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.pow;

import static quadx.numerics.integrate.InfiniteAdaptiveGaussKronrod.EPMACH;
import static quadx.numerics.integrate.InfiniteAdaptiveGaussKronrod.UFLOW;

import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * The 15-point Gauss-Kronrod rule applied to an integrand over an infinite domain after the
 * transformation onto (0,1] (QUADPACK qk15i).
 *
 * <p>The 7-point Gauss rule is embedded in the Kronrod rule, so 15 transformed abscissae give both
 * estimates. Their difference, refined by the QUADPACK heuristics, is the error estimate.
 *
 * <p>Adapted from the QUADPACK routine qk15i of R. Piessens, E. de Doncker-Kapenga, C. Ueberhuber
 * and D. Kahaner.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class InfiniteKronrodRule {

  /** Number of transformed abscissae per application of the rule. */
  public static final int POINTS = 15;

  /**
   * Abscissae of the 15-point Kronrod rule. XGK[1], XGK[3], ... are the 7-point Gauss abscissae;
   * XGK[0], XGK[2], ... are optimally added by Kronrod. XGK[7] is the centre.
   */
  private static final double[] XGK = {
      0.9914553711208126, 0.9491079123427585, 0.8648644233597691, 0.7415311855993944,
      0.5860872354676911, 0.4058451513773972, 0.2077849550078985, 0.0};

  /** Weights of the 15-point Kronrod rule. */
  private static final double[] WGK = {
      0.02293532201052922, 0.06309209262997855, 0.1047900103222502, 0.1406532597155259,
      0.1690047266392679, 0.1903505780647854, 0.2044329400752989, 0.2094821410847278};

  /** Weights of the 7-point Gauss rule, interleaved with zeros at the Kronrod-only abscissae. */
  private static final double[] WG = {
      0.0, 0.1294849661688697, 0.0, 0.2797053914892767, 0.0, 0.3818300505051189, 0.0,
      0.4179591836734694};

  private final UnivariateFunction function;
  private final InfiniteDomain domain;
  private final double bound;

  /**
   * Constructor for InfiniteKronrodRule.
   *
   * @param function The integrand.
   * @param domain The infinite domain.
   * @param bound The finite anchor of the transform (0 for the two-sided domain).
   */
  public InfiniteKronrodRule(UnivariateFunction function, InfiniteDomain domain, double bound) {
    this.function = function;
    this.domain = domain;
    this.bound = domain == InfiniteDomain.BOTH_INFINITE ? 0.0 : bound;
  }

  /**
   * Integrand evaluations performed by one call to {@link #estimate(double, double)}.
   *
   * @return 15, or 30 for the two-sided domain.
   */
  public int evaluationsPerEstimate() {
    return POINTS * domain.evaluationsPerPoint();
  }

  /**
   * Apply the rule to the transformed subinterval [a, b].
   *
   * @param a Left end of the subinterval, 0 &lt;= a &lt; b.
   * @param b Right end of the subinterval, b &lt;= 1.
   * @return The Kronrod estimate.
   */
  public KronrodEstimate estimate(double a, double b) {
    double[] fv1 = new double[7];
    double[] fv2 = new double[7];

    double centr = (a + b) * 0.5;
    double hlgth = (b - a) * 0.5;

    double fc = domain.evaluate(function, bound, centr) / centr / centr;

    // Kronrod and Gauss sums.
    double resg = WG[7] * fc;
    double resk = WGK[7] * fc;
    double resabs = abs(resk);
    for (int j = 0; j < 7; j++) {
      double absc = hlgth * XGK[j];
      double absc1 = centr - absc;
      double absc2 = centr + absc;
      double fval1 = domain.evaluate(function, bound, absc1);
      double fval2 = domain.evaluate(function, bound, absc2);
      fval1 = fval1 / absc1 / absc1;
      fval2 = fval2 / absc2 / absc2;
      fv1[j] = fval1;
      fv2[j] = fval2;
      double fsum = fval1 + fval2;
      resg += WG[j] * fsum;
      resk += WGK[j] * fsum;
      resabs += WGK[j] * (abs(fval1) + abs(fval2));
    }

    double reskh = resk * 0.5;
    double resasc = WGK[7] * abs(fc - reskh);
    for (int j = 0; j < 7; j++) {
      resasc += WGK[j] * (abs(fv1[j] - reskh) + abs(fv2[j] - reskh));
    }

    double result = resk * hlgth;
    resasc *= hlgth;
    resabs *= hlgth;
    double abserr = abs((resk - resg) * hlgth);
    if (resasc != 0.0 && abserr != 0.0) {
      abserr = resasc * min(1.0, pow(abserr * 200.0 / resasc, 1.5));
    }
    if (resabs > UFLOW / (EPMACH * 50.0)) {
      abserr = max(EPMACH * 50.0 * resabs, abserr);
    }
    return new KronrodEstimate(result, abserr, resabs, resasc);
  }
}

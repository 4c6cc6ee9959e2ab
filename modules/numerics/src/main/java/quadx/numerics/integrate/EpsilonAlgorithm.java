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

import static quadx.numerics.integrate.InfiniteAdaptiveGaussKronrod.EPMACH;
import static quadx.numerics.integrate.InfiniteAdaptiveGaussKronrod.OFLOW;

/**
 * Wynn's epsilon algorithm for accelerating the convergence of the sequence of partial areas
 * produced by the adaptive bisection (QUADPACK qelg).
 *
 * <p>The table holds the last elements of the main diagonal of the epsilon table. At most
 * {@link #LIMEXP} elements are kept; the two extra slots are working storage. The last three
 * extrapolated results form the basis of the error estimate once at least four extrapolations
 * have been performed.
 *
 * <p>Reference: P. Wynn, "On a device for computing the e_m(S_n) transformation," Mathematical
 * Tables and Other Aids to Computation, Vol. 10 (1956), pp. 91-96.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class EpsilonAlgorithm {

  /** Maximum number of elements in the epsilon table. */
  public static final int LIMEXP = 50;
  /** Epsilon table storage, including two working slots. */
  private final double[] epstab = new double[LIMEXP + 2];
  /** The last three extrapolated results. */
  private final double[] res3la = new double[3];
  /** Number of elements currently in the table. */
  private int n;
  /** Number of calls to {@link #extrapolate(double)}. */
  private int nres;
  /** The latest extrapolated result. */
  private double result;
  /** Error estimate of the latest extrapolated result. */
  private double abserr;

  /**
   * Start a table whose first element is the area of the initial (unbisected) estimate. The second
   * element is supplied by {@link #setLatest(double)} after the first bisection.
   *
   * @param initialArea The first partial area.
   */
  public EpsilonAlgorithm(double initialArea) {
    epstab[0] = initialArea;
    n = 2;
    nres = 0;
    result = initialArea;
    abserr = OFLOW;
  }

  /**
   * Overwrite the most recent element of the table.
   *
   * @param value The partial area.
   */
  public void setLatest(double value) {
    epstab[n - 1] = value;
  }

  /**
   * Append a partial area to the table and compute a new extrapolated estimate.
   *
   * @param value The partial area.
   */
  public void extrapolate(double value) {
    n++;
    epstab[n - 1] = value;
    nres++;
    abserr = OFLOW;
    result = epstab[n - 1];

    if (n >= 3) {
      boolean converged = epsilonTable();
      if (!converged) {
        updateErrorEstimate();
      }
    }
    abserr = max(abserr, EPMACH * 5.0 * abs(result));
  }

  /**
   * Compute the new diagonal of the epsilon table, then shift and compact it.
   *
   * @return true if three consecutive elements agreed to machine accuracy, in which case result and
   *     abserr are final and the table is left unshifted.
   */
  private boolean epsilonTable() {
    epstab[n + 1] = epstab[n - 1];
    int newelm = (n - 1) / 2;
    epstab[n - 1] = OFLOW;
    int num = n;
    int k1 = n - 1;
    for (int i = 1; i <= newelm; i++) {
      int k2 = k1 - 1;
      int k3 = k1 - 2;
      double res = epstab[k1 + 2];
      double e0 = epstab[k3];
      double e1 = epstab[k2];
      double e2 = res;
      double e1abs = abs(e1);
      double delta2 = e2 - e1;
      double err2 = abs(delta2);
      double tol2 = max(abs(e2), e1abs) * EPMACH;
      double delta3 = e1 - e0;
      double err3 = abs(delta3);
      double tol3 = max(e1abs, abs(e0)) * EPMACH;
      if (err2 <= tol2 && err3 <= tol3) {
        // e0, e1 and e2 are equal to within machine accuracy; convergence is assumed.
        result = res;
        abserr = err2 + err3;
        return true;
      }

      double e3 = epstab[k1];
      epstab[k1] = e1;
      double delta1 = e1 - e3;
      double err1 = abs(delta1);
      double tol1 = max(e1abs, abs(e3)) * EPMACH;

      // Two elements very close to each other; omit part of the table.
      if (err1 <= tol1 || err2 <= tol2 || err3 <= tol3) {
        n = i + i - 1;
        break;
      }
      double ss = 1.0 / delta1 + 1.0 / delta2 - 1.0 / delta3;
      double epsinf = abs(ss * e1);

      // Irregular behaviour in the table; omit part of the table.
      if (epsinf <= 1.0e-4) {
        n = i + i - 1;
        break;
      }

      res = e1 + 1.0 / ss;
      epstab[k1] = res;
      k1 -= 2;
      double error = err2 + abs(res - e2) + err3;
      if (error <= abserr) {
        abserr = error;
        result = res;
      }
    }

    // Shift the table.
    if (n == LIMEXP) {
      n = 2 * (LIMEXP / 2) - 1;
    }
    int ib = (num % 2 == 0) ? 1 : 0;
    int ie = newelm + 1;
    for (int i = 0; i < ie; i++) {
      epstab[ib] = epstab[ib + 2];
      ib += 2;
    }
    if (num != n) {
      int indx = num - n;
      for (int i = 0; i < n; i++) {
        epstab[i] = epstab[indx];
        indx++;
      }
    }
    return false;
  }

  /** Record the latest result and estimate its error from the last three results. */
  private void updateErrorEstimate() {
    if (nres < 4) {
      res3la[nres - 1] = result;
      abserr = OFLOW;
    } else {
      abserr = abs(result - res3la[2]) + abs(result - res3la[1]) + abs(result - res3la[0]);
      res3la[0] = res3la[1];
      res3la[1] = res3la[2];
      res3la[2] = result;
    }
  }

  /**
   * Number of elements in the table.
   *
   * @return the table size.
   */
  public int size() {
    return n;
  }

  /**
   * Number of extrapolations performed.
   *
   * @return the extrapolation count.
   */
  public int getExtrapolations() {
    return nres;
  }

  public double getResult() {
    return result;
  }

  public double getAbsoluteError() {
    return abserr;
  }
}

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
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.ulp;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * Adaptive Gauss-Kronrod quadrature over semi-infinite and infinite intervals (QUADPACK qagi).
 *
 * <p>The domain is mapped onto (0,1] (see {@link InfiniteDomain}) and integrated with the 15-point
 * Kronrod rule ({@link InfiniteKronrodRule}). The subinterval with the largest error estimate is
 * bisected until the summed error satisfies max(absoluteTolerance, relativeTolerance * |integral|).
 * When the large-error subintervals have been reduced to the smallest width, the sequence of
 * partial areas is accelerated by Wynn's epsilon algorithm ({@link EpsilonAlgorithm}).
 *
 * <p>Numerical degradation is reported through {@link QuadratureStatus}, never thrown; the best
 * available estimate is always returned. Malformed domains throw IllegalArgumentException.
 *
 * <p>Instances hold configuration and the most recent result only, and are not thread-safe; each
 * call to {@link #compute()} allocates its own working storage. The static {@code integrate}
 * methods may be called concurrently.
 *
 * <p>Adapted from the QUADPACK routines qagi and qagie of R. Piessens, E. de Doncker-Kapenga,
 * C. Ueberhuber and D. Kahaner.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class InfiniteAdaptiveGaussKronrod {

  private static final Logger logger =
      Logger.getLogger(InfiniteAdaptiveGaussKronrod.class.getName());

  /** Relative machine accuracy. */
  static final double EPMACH = ulp(1.0);
  /** Smallest positive normalized magnitude. */
  static final double UFLOW = Double.MIN_NORMAL;
  /** Largest magnitude. */
  static final double OFLOW = Double.MAX_VALUE;

  /** Default absolute tolerance. */
  public static final double DEFAULT_ABSOLUTE_TOLERANCE = 0.0;
  /** Default relative tolerance. */
  public static final double DEFAULT_RELATIVE_TOLERANCE = 1.0e-3;
  /** Default maximum number of subintervals. */
  public static final int DEFAULT_MAX_SUBINTERVALS = 100;

  /** Termination branches of the bisection loop. */
  private enum Termination {
    /** Choose between the extrapolated result and the sum of the subinterval areas. */
    TEST_RESULT,
    /** Test the extrapolated result for divergence. */
    TEST_DIVERGENCE,
    /** Return the sum of the subinterval areas. */
    SUM_AREAS,
    /** Return the current result. */
    DONE
  }

  private UnivariateFunction function;
  private double lowerBound = 0.0;
  private double upperBound = Double.POSITIVE_INFINITY;
  private InfiniteDomain domain = InfiniteDomain.UPPER_INFINITE;
  private double absoluteTolerance = DEFAULT_ABSOLUTE_TOLERANCE;
  private double relativeTolerance = DEFAULT_RELATIVE_TOLERANCE;
  private int maxSubintervals = DEFAULT_MAX_SUBINTERVALS;
  private QuadratureListener listener = null;
  private QuadratureResult quadratureResult = null;

  /**
   * Integrate a function over [0, +inf) with the default tolerances. Use {@link #setRange(double,
   * double)} to select another domain.
   *
   * @param function The integrand.
   */
  public InfiniteAdaptiveGaussKronrod(UnivariateFunction function) {
    setFunction(function);
  }

  /**
   * Integrate a function over [0, +inf), reading the tolerances and the subinterval limit from the
   * properties <code>quadrature-absolute-tolerance</code>,
   * <code>quadrature-relative-tolerance</code> and <code>quadrature-max-subintervals</code>.
   *
   * @param function The integrand.
   * @param properties Configuration properties.
   */
  public InfiniteAdaptiveGaussKronrod(UnivariateFunction function,
      CompositeConfiguration properties) {
    this(function);
    absoluteTolerance =
        properties.getDouble("quadrature-absolute-tolerance", DEFAULT_ABSOLUTE_TOLERANCE);
    relativeTolerance =
        properties.getDouble("quadrature-relative-tolerance", DEFAULT_RELATIVE_TOLERANCE);
    maxSubintervals = properties.getInt("quadrature-max-subintervals", DEFAULT_MAX_SUBINTERVALS);
  }

  /**
   * Integrate f over [a, b], where a, b or both are infinite, with the default tolerances.
   *
   * @param f The integrand.
   * @param a Lower bound (finite or negative infinity).
   * @param b Upper bound (finite or positive infinity).
   * @return The quadrature result.
   * @throws IllegalArgumentException if neither bound is infinite.
   */
  public static QuadratureResult integrate(UnivariateFunction f, double a, double b) {
    return integrate(f, a, b, DEFAULT_ABSOLUTE_TOLERANCE, DEFAULT_RELATIVE_TOLERANCE);
  }

  /**
   * Integrate f over [a, b], where a, b or both are infinite.
   *
   * @param f The integrand.
   * @param a Lower bound (finite or negative infinity).
   * @param b Upper bound (finite or positive infinity).
   * @param absoluteTolerance Requested absolute accuracy.
   * @param relativeTolerance Requested relative accuracy.
   * @return The quadrature result.
   * @throws IllegalArgumentException if neither bound is infinite.
   */
  public static QuadratureResult integrate(UnivariateFunction f, double a, double b,
      double absoluteTolerance, double relativeTolerance) {
    return integrate(f, a, b, absoluteTolerance, relativeTolerance, DEFAULT_MAX_SUBINTERVALS);
  }

  /**
   * Integrate f over [a, b], where a, b or both are infinite.
   *
   * @param f The integrand.
   * @param a Lower bound (finite or negative infinity).
   * @param b Upper bound (finite or positive infinity).
   * @param absoluteTolerance Requested absolute accuracy.
   * @param relativeTolerance Requested relative accuracy.
   * @param maxSubintervals Maximum number of subintervals.
   * @return The quadrature result.
   * @throws IllegalArgumentException if neither bound is infinite.
   */
  public static QuadratureResult integrate(UnivariateFunction f, double a, double b,
      double absoluteTolerance, double relativeTolerance, int maxSubintervals) {
    InfiniteAdaptiveGaussKronrod quadrature = new InfiniteAdaptiveGaussKronrod(f);
    quadrature.setRange(a, b);
    quadrature.setAbsoluteTolerance(absoluteTolerance);
    quadrature.setRelativeTolerance(relativeTolerance);
    quadrature.setMaxSubintervals(maxSubintervals);
    return quadrature.compute();
  }

  /**
   * Compute the integral over the current range.
   *
   * @return The quadrature result, also available from {@link #getResult()}.
   */
  public QuadratureResult compute() {
    quadratureResult = qagie(domain.anchor(lowerBound, upperBound));
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Integral over [%s, %s]:\n%s", lowerBound, upperBound,
          quadratureResult));
    }
    return quadratureResult;
  }

  /**
   * The adaptive bisection driver.
   *
   * @param bound Finite anchor of the domain transform.
   * @return The quadrature result.
   */
  private QuadratureResult qagie(double bound) {
    double epsabs = absoluteTolerance;
    double epsrel = relativeTolerance;
    int limit = maxSubintervals;

    // Test on validity of parameters.
    if (limit < 1 || Double.isNaN(epsabs) || Double.isNaN(epsrel)
        || (epsabs <= 0.0 && epsrel < max(EPMACH * 50.0, 5.0e-15))) {
      logger.fine(format(" Invalid quadrature input: absolute tolerance %10.4e, "
          + "relative tolerance %10.4e, subinterval limit %d.", epsabs, epsrel, limit));
      return new QuadratureResult(0.0, 0.0, 0, 0, QuadratureStatus.INPUT_INVALID);
    }

    InfiniteKronrodRule rule = new InfiniteKronrodRule(function, domain, bound);
    SubintervalList list = new SubintervalList(limit);

    // First approximation to the integral over (0,1].
    KronrodEstimate initial = rule.estimate(0.0, 1.0);
    double result = initial.getArea();
    double abserr = initial.getAbsoluteError();
    double defabs = initial.getAbsoluteArea();
    double resasc = initial.getMeanDeviation();
    list.initialize(result, abserr);
    int last = 1;
    int ier = 0;

    // Test on accuracy.
    double dres = abs(result);
    double errbnd = max(epsabs, epsrel * dres);
    if (abserr <= EPMACH * 100.0 * defabs && abserr > errbnd) {
      ier = 2;
    }
    if (limit == 1) {
      ier = 1;
    }
    if (ier != 0 || (abserr <= errbnd && abserr != resasc) || abserr == 0.0) {
      return finish(result, abserr, last, ier);
    }

    // Initialization.
    EpsilonAlgorithm epsilon = new EpsilonAlgorithm(result);
    double area = result;
    double errsum = abserr;
    abserr = OFLOW;
    int ktmin = 0;
    boolean extrap = false;
    boolean noext = false;
    int ierro = 0;
    int iroff1 = 0;
    int iroff2 = 0;
    int iroff3 = 0;
    int ksgn = -1;
    if (dres >= (1.0 - EPMACH * 50.0) * defabs) {
      ksgn = 1;
    }
    double small = 0.0;
    double erlarg = 0.0;
    double ertest = 0.0;
    double correc = 0.0;

    // Main loop.
    Termination termination = Termination.TEST_RESULT;
    for (last = 2; last <= limit; last++) {

      // Bisect the subinterval with the nrmax-th largest error estimate.
      int maxerr = list.getMaxErrorIndex();
      double errmax = list.getMaxError();
      double a1 = list.getLeft(maxerr);
      double b1 = (list.getLeft(maxerr) + list.getRight(maxerr)) * 0.5;
      double a2 = b1;
      double b2 = list.getRight(maxerr);
      double erlast = errmax;
      KronrodEstimate lower = rule.estimate(a1, b1);
      KronrodEstimate upper = rule.estimate(a2, b2);

      // Improve previous approximations to the integral and error, and test for accuracy.
      double area12 = lower.getArea() + upper.getArea();
      double erro12 = lower.getAbsoluteError() + upper.getAbsoluteError();
      errsum = errsum + erro12 - errmax;
      area = area + area12 - list.getArea(maxerr);
      if (lower.getMeanDeviation() != lower.getAbsoluteError()
          && upper.getMeanDeviation() != upper.getAbsoluteError()) {
        if (abs(list.getArea(maxerr) - area12) <= abs(area12) * 1.0e-5
            && erro12 >= errmax * 0.99) {
          if (extrap) {
            iroff2++;
          } else {
            iroff1++;
          }
        }
        if (last > 10 && erro12 > errmax) {
          iroff3++;
        }
      }
      errbnd = max(epsabs, epsrel * abs(area));

      // Test for roundoff error.
      if (iroff1 + iroff2 >= 10 || iroff3 >= 20) {
        ier = 2;
      }
      if (iroff2 >= 5) {
        ierro = 3;
      }

      // The number of subintervals equals the limit.
      if (last == limit) {
        ier = 1;
      }

      // Bad integrand behaviour at some point of the integration range.
      if (max(abs(a1), abs(b2)) <= (1.0 + EPMACH * 100.0) * (abs(a2) + UFLOW * 1.0e3)) {
        ier = 4;
      }

      // Append the newly created subintervals and restore the descending error order.
      list.bisect(maxerr, b1, lower, upper);
      list.sort();

      if (logger.isLoggable(Level.FINEST)) {
        logger.finest(format(" Subinterval %4d: area %20.14e error sum %10.4e", last, area,
            errsum));
      }
      boolean stop = listener != null && !listener.bisectionUpdate(last, area, errsum, list);

      if (errsum <= errbnd) {
        termination = Termination.SUM_AREAS;
        break;
      }
      if (ier != 0) {
        break;
      }
      if (stop) {
        ier = 1;
        break;
      }
      if (last == 2) {
        small = 0.375;
        erlarg = errsum;
        ertest = errbnd;
        epsilon.setLatest(area);
        continue;
      }
      if (noext) {
        continue;
      }

      erlarg -= erlast;
      if (abs(b1 - a1) > small) {
        erlarg += erro12;
      }
      if (!extrap) {
        // Test whether the subinterval to be bisected next is the smallest.
        if (list.getWidth(list.getMaxErrorIndex()) > small) {
          continue;
        }
        extrap = true;
        list.setPosition(1);
      }

      if (ierro != 3 && erlarg > ertest) {
        // The smallest subinterval has the largest error. Before bisecting, decrease the sum of
        // the errors over the larger subintervals (erlarg) and perform extrapolation.
        int jupbnd = last;
        if (last > limit / 2 + 2) {
          jupbnd = limit + 3 - last;
        }
        boolean largeRemains = false;
        for (int k = list.getPosition(); k < jupbnd; k++) {
          list.selectPosition(list.getPosition());
          if (list.getWidth(list.getMaxErrorIndex()) > small) {
            largeRemains = true;
            break;
          }
          list.setPosition(list.getPosition() + 1);
        }
        if (largeRemains) {
          continue;
        }
      }

      // Perform extrapolation.
      epsilon.extrapolate(area);
      ktmin++;
      if (ktmin > 5 && abserr < errsum * 1.0e-3) {
        ier = 5;
      }
      if (epsilon.getAbsoluteError() < abserr) {
        ktmin = 0;
        abserr = epsilon.getAbsoluteError();
        result = epsilon.getResult();
        correc = erlarg;
        ertest = max(epsabs, epsrel * abs(result));
        if (abserr <= ertest) {
          break;
        }
      }

      // Prepare bisection of the smallest subinterval.
      if (epsilon.size() == 1) {
        noext = true;
      }
      if (ier == 5) {
        break;
      }
      list.selectPosition(0);
      extrap = false;
      small *= 0.5;
      erlarg = errsum;
    }

    // Set the final result and error estimate.
    if (termination == Termination.TEST_RESULT) {
      if (abserr == OFLOW) {
        termination = Termination.SUM_AREAS;
      } else if (ier + ierro == 0) {
        termination = Termination.TEST_DIVERGENCE;
      } else {
        if (ierro == 3) {
          abserr += correc;
        }
        if (ier == 0) {
          ier = 3;
        }
        if (result != 0.0 && area != 0.0) {
          if (abserr / abs(result) > errsum / abs(area)) {
            termination = Termination.SUM_AREAS;
          } else {
            termination = Termination.TEST_DIVERGENCE;
          }
        } else if (abserr > errsum) {
          termination = Termination.SUM_AREAS;
        } else if (area == 0.0) {
          termination = Termination.DONE;
        } else {
          termination = Termination.TEST_DIVERGENCE;
        }
      }
    }

    if (termination == Termination.TEST_DIVERGENCE) {
      if (ksgn != -1 || max(abs(result), abs(area)) > defabs * 0.01) {
        if (0.01 > result / area || result / area > 100.0 || errsum > abs(area)) {
          ier = 6;
        }
      }
    } else if (termination == Termination.SUM_AREAS) {
      result = list.totalArea();
      abserr = errsum;
    }

    return finish(result, abserr, last, ier);
  }

  /**
   * Count the integrand evaluations and translate the internal error code.
   *
   * @param value The integral estimate.
   * @param abserr The error estimate.
   * @param last Number of subintervals.
   * @param ier Internal error code.
   * @return The quadrature result.
   */
  private QuadratureResult finish(double value, double abserr, int last, int ier) {
    int neval = last * 30 - 15;
    if (domain == InfiniteDomain.BOTH_INFINITE) {
      neval *= 2;
    }
    // Codes 3 and above are shifted down by one; the internal code 3 marks roundoff in the
    // extrapolation table and is reported as ROUNDOFF_LIMITED.
    if (ier > 2) {
      ier--;
    }
    QuadratureStatus status = QuadratureStatus.fromCode(ier);
    if (!status.isSuccess()) {
      logger.fine(format(" Quadrature over %s terminated: %s.", domain, status.getDescription()));
    }
    return new QuadratureResult(value, abserr, neval, last, status);
  }

  /**
   * Set the integration range. One or both bounds must be infinite.
   *
   * @param a Lower bound (finite or negative infinity).
   * @param b Upper bound (finite or positive infinity).
   * @throws IllegalArgumentException if neither bound is infinite, either is NaN, or the bounds
   *     are reversed.
   */
  public void setRange(double a, double b) {
    domain = InfiniteDomain.of(a, b);
    lowerBound = a;
    upperBound = b;
  }

  public double getLowerBound() {
    return lowerBound;
  }

  public double getUpperBound() {
    return upperBound;
  }

  public InfiniteDomain getDomain() {
    return domain;
  }

  public UnivariateFunction getFunction() {
    return function;
  }

  /**
   * Set the integrand.
   *
   * @param function The integrand.
   */
  public void setFunction(UnivariateFunction function) {
    this.function = Objects.requireNonNull(function, " The integrand must not be null.");
  }

  public double getAbsoluteTolerance() {
    return absoluteTolerance;
  }

  public void setAbsoluteTolerance(double absoluteTolerance) {
    this.absoluteTolerance = absoluteTolerance;
  }

  public double getRelativeTolerance() {
    return relativeTolerance;
  }

  public void setRelativeTolerance(double relativeTolerance) {
    this.relativeTolerance = relativeTolerance;
  }

  public int getMaxSubintervals() {
    return maxSubintervals;
  }

  /**
   * Set the maximum number of subintervals. Values below 1 are reported as INPUT_INVALID by
   * {@link #compute()}.
   *
   * @param maxSubintervals The subinterval limit.
   */
  public void setMaxSubintervals(int maxSubintervals) {
    this.maxSubintervals = maxSubintervals;
  }

  /**
   * Set a listener to be notified after each bisection.
   *
   * @param listener The listener, or null to remove it.
   */
  public void setListener(QuadratureListener listener) {
    this.listener = listener;
  }

  /**
   * The result of the most recent call to {@link #compute()}.
   *
   * @return the result, or null if nothing has been computed.
   */
  public QuadratureResult getResult() {
    return quadratureResult;
  }

  /**
   * The most recent estimate of the integral.
   *
   * @return the area.
   */
  public double getArea() {
    return computed().getValue();
  }

  /**
   * The most recent estimate of the absolute error.
   *
   * @return the error.
   */
  public double getError() {
    return computed().getError();
  }

  public int getFunctionEvaluations() {
    return computed().getEvaluations();
  }

  public int getSubintervals() {
    return computed().getSubintervals();
  }

  public QuadratureStatus getStatus() {
    return computed().getStatus();
  }

  private QuadratureResult computed() {
    if (quadratureResult == null) {
      throw new IllegalStateException(" No integral has been computed.");
    }
    return quadratureResult;
  }
}

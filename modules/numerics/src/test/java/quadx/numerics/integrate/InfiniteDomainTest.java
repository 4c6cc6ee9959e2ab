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

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.junit.Assert;
import org.junit.Test;
import quadx.utilities.QuadXTest;

/**
 * Classification of integration bounds and the map between x and t.
 *
 * @author Michael J. Schnieders
 */
public class InfiniteDomainTest extends QuadXTest {

  private static final double INF = Double.POSITIVE_INFINITY;

  @Test
  public void testClassification() {
    Assert.assertEquals(InfiniteDomain.UPPER_INFINITE, InfiniteDomain.of(3.0, INF));
    Assert.assertEquals(InfiniteDomain.LOWER_INFINITE, InfiniteDomain.of(-INF, -2.0));
    Assert.assertEquals(InfiniteDomain.BOTH_INFINITE, InfiniteDomain.of(-INF, INF));
    Assert.assertEquals(1, InfiniteDomain.UPPER_INFINITE.getCode());
    Assert.assertEquals(-1, InfiniteDomain.LOWER_INFINITE.getCode());
    Assert.assertEquals(2, InfiniteDomain.BOTH_INFINITE.getCode());
  }

  @Test
  public void testInvalidBounds() {
    Assert.assertThrows(IllegalArgumentException.class, () -> InfiniteDomain.of(0.0, 1.0));
    Assert.assertThrows(IllegalArgumentException.class, () -> InfiniteDomain.of(INF, 0.0));
    Assert.assertThrows(IllegalArgumentException.class, () -> InfiniteDomain.of(0.0, -INF));
    Assert.assertThrows(IllegalArgumentException.class, () -> InfiniteDomain.of(Double.NaN, INF));
  }

  @Test
  public void testAnchor() {
    Assert.assertEquals(3.0, InfiniteDomain.UPPER_INFINITE.anchor(3.0, INF), 0.0);
    Assert.assertEquals(-2.0, InfiniteDomain.LOWER_INFINITE.anchor(-INF, -2.0), 0.0);
    Assert.assertEquals(0.0, InfiniteDomain.BOTH_INFINITE.anchor(-INF, INF), 0.0);
  }

  @Test
  public void testTransform() {
    // t = 1 maps onto the finite bound and t = 1/2 lies one unit inside the domain.
    Assert.assertEquals(3.0, InfiniteDomain.UPPER_INFINITE.toX(3.0, 1.0), 0.0);
    Assert.assertEquals(4.0, InfiniteDomain.UPPER_INFINITE.toX(3.0, 0.5), 0.0);
    Assert.assertEquals(-3.0, InfiniteDomain.LOWER_INFINITE.toX(-2.0, 0.5), 0.0);
    Assert.assertEquals(0.25, InfiniteDomain.UPPER_INFINITE.toT(3.0, 6.0), 0.0);
    Assert.assertEquals(0.25, InfiniteDomain.LOWER_INFINITE.toT(-2.0, -5.0), 0.0);
    Assert.assertEquals(0.25, InfiniteDomain.BOTH_INFINITE.toT(0.0, -3.0), 0.0);
    for (InfiniteDomain domain : InfiniteDomain.values()) {
      double bound = domain == InfiniteDomain.BOTH_INFINITE ? 0.0 : 1.0;
      Assert.assertEquals(domain.toString(), 0.3, domain.toT(bound, domain.toX(bound, 0.3)),
          1.0e-15);
    }
  }

  @Test
  public void testTwoSidedFold() {
    UnivariateFunction f = (double x) -> x > 0.0 ? 1.0 : 10.0;
    Assert.assertEquals(11.0, InfiniteDomain.BOTH_INFINITE.evaluate(f, 0.0, 0.5), 0.0);
    Assert.assertEquals(1.0, InfiniteDomain.UPPER_INFINITE.evaluate(f, 0.0, 0.5), 0.0);
    Assert.assertEquals(10.0, InfiniteDomain.LOWER_INFINITE.evaluate(f, 0.0, 0.5), 0.0);
    Assert.assertEquals(2, InfiniteDomain.BOTH_INFINITE.evaluationsPerPoint());
    Assert.assertEquals(1, InfiniteDomain.UPPER_INFINITE.evaluationsPerPoint());
  }
}

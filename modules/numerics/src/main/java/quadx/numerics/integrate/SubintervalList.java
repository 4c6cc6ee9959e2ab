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
 * The working list of the adaptive quadrature: subintervals of the transformed domain (0,1] with
 * their area and error estimates, plus an index array that keeps the subintervals ordered by
 * descending error estimate.
 *
 * <p>Subintervals live in an arena of fixed capacity and are never merged or removed; bisection
 * overwrites the parent slot with one child and appends the other. The ordering is maintained
 * incrementally (QUADPACK qpsrt): only the entries between the current position of the bisected
 * subinterval and the bottom of the maintained part are shifted. When few subdivisions remain,
 * only the top <code>limit + 3 - size</code> entries are kept in order, since the others can never
 * be selected for bisection.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SubintervalList {

  /** Maximum number of subintervals. */
  private final int limit;
  /** Left end of each subinterval. */
  private final double[] left;
  /** Right end of each subinterval. */
  private final double[] right;
  /** Area estimate of each subinterval. */
  private final double[] area;
  /** Error estimate of each subinterval. */
  private final double[] error;
  /** Subinterval indices in order of descending error estimate. */
  private final int[] order;
  /** Number of subintervals in use. */
  private int size;
  /** Index of the subinterval to be bisected next. */
  private int maxErrorIndex;
  /** Error estimate of the subinterval to be bisected next. */
  private double maxError;
  /** Position of the subinterval to be bisected next within the ordering. */
  private int position;

  /**
   * Constructor for SubintervalList.
   *
   * @param limit Maximum number of subintervals.
   */
  public SubintervalList(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException(format(" The subinterval limit (%d) must be positive.", limit));
    }
    this.limit = limit;
    left = new double[limit];
    right = new double[limit];
    area = new double[limit];
    error = new double[limit];
    order = new int[limit];
  }

  /**
   * Reset the list to the single subinterval (0,1].
   *
   * @param initialArea Area estimate over (0,1].
   * @param initialError Error estimate over (0,1].
   */
  void initialize(double initialArea, double initialError) {
    left[0] = 0.0;
    right[0] = 1.0;
    area[0] = initialArea;
    error[0] = initialError;
    order[0] = 0;
    size = 1;
    maxErrorIndex = 0;
    maxError = initialError;
    position = 0;
  }

  /**
   * Record the bisection of a subinterval at its midpoint. The child with the larger error takes
   * the parent slot and the other child is appended.
   *
   * @param parent Index of the bisected subinterval.
   * @param midpoint The bisection point.
   * @param lower Estimate for the lower half.
   * @param upper Estimate for the upper half.
   */
  void bisect(int parent, double midpoint, KronrodEstimate lower, KronrodEstimate upper) {
    if (size >= limit) {
      throw new IllegalStateException(format(" The subinterval limit (%d) has been reached.", limit));
    }
    int child = size;
    double a1 = left[parent];
    double b2 = right[parent];
    if (upper.getAbsoluteError() > lower.getAbsoluteError()) {
      left[parent] = midpoint;
      left[child] = a1;
      right[child] = midpoint;
      area[parent] = upper.getArea();
      area[child] = lower.getArea();
      error[parent] = upper.getAbsoluteError();
      error[child] = lower.getAbsoluteError();
    } else {
      left[child] = midpoint;
      right[parent] = midpoint;
      right[child] = b2;
      area[parent] = lower.getArea();
      area[child] = upper.getArea();
      error[parent] = lower.getAbsoluteError();
      error[child] = upper.getAbsoluteError();
    }
    size++;
  }

  /**
   * Restore the descending error order after a bisection, then select the subinterval at the
   * current position as the next to bisect (QUADPACK qpsrt).
   */
  void sort() {
    if (size <= 2) {
      order[0] = 0;
      order[1] = 1;
      select();
      return;
    }

    // If subdivision increased the error estimate of the parent slot, move it up first.
    double errmax = error[maxErrorIndex];
    int ido = position;
    for (int i = 0; i < ido; i++) {
      int isucc = order[position - 1];
      if (errmax <= error[isucc]) {
        break;
      }
      order[position] = isucc;
      position--;
    }

    // Bottom of the part of the ordering that must be maintained.
    int bottom = size - 1;
    if (size > limit / 2 + 2) {
      bottom = limit + 2 - size;
    }
    double errmin = error[size - 1];

    // Insert errmax by traversing the list top-down.
    int jbnd = bottom - 1;
    int i = position + 1;
    for (; i <= jbnd; i++) {
      int isucc = order[i];
      if (errmax >= error[isucc]) {
        break;
      }
      order[i - 1] = isucc;
    }

    if (i > jbnd) {
      order[jbnd] = maxErrorIndex;
      order[bottom] = size - 1;
    } else {
      // Insert errmin by traversing the list bottom-up.
      order[i - 1] = maxErrorIndex;
      int k = jbnd;
      boolean placed = false;
      for (int j = i; j <= jbnd; j++) {
        int isucc = order[k];
        if (errmin < error[isucc]) {
          order[k + 1] = size - 1;
          placed = true;
          break;
        }
        order[k + 1] = isucc;
        k--;
      }
      if (!placed) {
        order[i] = size - 1;
      }
    }
    select();
  }

  /** Select the subinterval at the current position for bisection. */
  private void select() {
    maxErrorIndex = order[position];
    maxError = error[maxErrorIndex];
  }

  /**
   * Move the selection to a position of the ordering.
   *
   * @param position Position within the descending error order.
   */
  void selectPosition(int position) {
    this.position = position;
    select();
  }

  /**
   * Move the current position without changing the selected subinterval.
   *
   * @param position Position within the descending error order.
   */
  void setPosition(int position) {
    this.position = position;
  }

  public int getPosition() {
    return position;
  }

  public int getMaxErrorIndex() {
    return maxErrorIndex;
  }

  public double getMaxError() {
    return maxError;
  }

  /**
   * Number of subintervals in use.
   *
   * @return the size.
   */
  public int size() {
    return size;
  }

  public int getLimit() {
    return limit;
  }

  /**
   * Index of the subinterval at a position of the descending error order.
   *
   * @param position Position within the ordering.
   * @return Subinterval index.
   */
  public int getOrderedIndex(int position) {
    return order[position];
  }

  public double getLeft(int index) {
    return left[index];
  }

  public double getRight(int index) {
    return right[index];
  }

  public double getArea(int index) {
    return area[index];
  }

  public double getError(int index) {
    return error[index];
  }

  /**
   * Width of a subinterval in the transformed coordinate.
   *
   * @param index Subinterval index.
   * @return right - left.
   */
  public double getWidth(int index) {
    return right[index] - left[index];
  }

  /**
   * Sum of the subinterval widths; 1 for a valid partition of (0,1].
   *
   * @return the total width.
   */
  public double totalWidth() {
    double sum = 0.0;
    for (int i = 0; i < size; i++) {
      sum += right[i] - left[i];
    }
    return sum;
  }

  /**
   * Sum of the subinterval area estimates.
   *
   * @return the total area.
   */
  public double totalArea() {
    double sum = 0.0;
    for (int i = 0; i < size; i++) {
      sum += area[i];
    }
    return sum;
  }

  /**
   * Sum of the subinterval error estimates.
   *
   * @return the total error.
   */
  public double totalError() {
    double sum = 0.0;
    for (int i = 0; i < size; i++) {
      sum += error[i];
    }
    return sum;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(" %d of %d subintervals\n", size, limit));
    sb.append(format(" %5s %12s %12s %16s %12s\n", "Index", "Left", "Right", "Area", "Error"));
    for (int i = 0; i < size; i++) {
      sb.append(format(" %5d %12.6e %12.6e %16.10e %12.4e\n", i, left[i], right[i], area[i],
          error[i]));
    }
    return sb.toString();
  }
}

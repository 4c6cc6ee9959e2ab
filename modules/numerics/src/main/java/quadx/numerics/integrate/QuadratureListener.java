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
 * The QuadratureListener interface is used by the adaptive quadrature to report progress after each
 * bisection.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface QuadratureListener {

  /**
   * After each bisection, the adaptive quadrature will update the listener. It can be used to log
   * status messages, check the working list or gracefully terminate the quadrature.
   *
   * @param subintervals Number of subintervals.
   * @param area Current sum of the subinterval areas.
   * @param errorSum Current sum of the subinterval error estimates.
   * @param workingList The subintervals, in their current descending error order.
   * @return A return value of false will terminate the quadrature, reporting
   *     MAX_SUBDIVISIONS_REACHED unless a more specific status applies.
   */
  boolean bisectionUpdate(int subintervals, double area, double errorSum,
      SubintervalList workingList);
}

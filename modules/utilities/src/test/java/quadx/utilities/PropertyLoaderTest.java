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
package quadx.utilities;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FileUtils;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Test the precedence of configuration sources.
 *
 * @author Michael J. Schnieders
 */
public class PropertyLoaderTest extends QuadXTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testSystemProperty() {
    System.setProperty("quadrature-relative-tolerance", "1.0e-6");
    CompositeConfiguration properties = PropertyLoader.loadProperties(null);
    Assert.assertEquals(1.0e-6, properties.getDouble("quadrature-relative-tolerance"), 0.0);
    Assert.assertFalse(properties.containsKey("propertyFile"));
  }

  @Test
  public void testInputProperties() throws IOException {
    File input = folder.newFile("integrand.dat");
    File propertyFile = new File(folder.getRoot(), "integrand.properties");
    FileUtils.writeStringToFile(propertyFile,
        "quadrature-max-subintervals = 200\nquadrature-absolute-tolerance = 1.0e-9\n",
        StandardCharsets.UTF_8);

    CompositeConfiguration properties = PropertyLoader.loadProperties(input);
    Assert.assertEquals(200, properties.getInt("quadrature-max-subintervals"));
    Assert.assertEquals(1.0e-9, properties.getDouble("quadrature-absolute-tolerance"), 0.0);
    Assert.assertEquals(propertyFile.getCanonicalPath(), properties.getString("propertyFile"));
  }

  @Test
  public void testSystemPropertyTakesPrecedence() throws IOException {
    File input = folder.newFile("integrand.dat");
    FileUtils.writeStringToFile(new File(folder.getRoot(), "integrand.prop"),
        "quadrature-max-subintervals = 200\n", StandardCharsets.UTF_8);
    System.setProperty("quadrature-max-subintervals", "75");

    CompositeConfiguration properties = PropertyLoader.loadProperties(input);
    Assert.assertEquals(75, properties.getInt("quadrature-max-subintervals"));
  }

  @Test
  public void testMissingInputProperties() throws IOException {
    File input = folder.newFile("other.dat");
    CompositeConfiguration properties = PropertyLoader.loadProperties(input);
    Assert.assertEquals(100, properties.getInt("quadrature-max-subintervals", 100));
  }
}

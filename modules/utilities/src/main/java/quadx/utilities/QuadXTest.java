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

import static java.lang.String.format;

import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;

/**
 * The QuadXTest configures the context for QuadX tests. This includes:
 * <br>
 * 1) Sets testing related environment variables; set "-Dquadx.ci=true" for a CI environment
 * (default: false).
 * <br>
 * 2) Configures the logging level, using the quadx.test.log System property (default: WARNING).
 * <br>
 * 3) Stores System properties prior to each test, and restores them after each test (i.e.
 * properties set by a test do not effect the next test).
 *
 * @author Michael J. Schnieders
 */
public abstract class QuadXTest {

  /** Constant <code>quadxCI=System.getProperty("quadx.ci", "false").equalsIgnoreCase("true")</code> */
  public static final boolean quadxCI =
      System.getProperty("quadx.ci", "false").equalsIgnoreCase("true");

  /** Constant <code>logger</code> */
  protected static final Logger logger = Logger.getLogger(QuadXTest.class.getName());

  private static final Level origLevel;
  private static final Level testLevel;
  private Properties properties;

  static {
    Level level;
    try {
      level = Level.parse(System.getProperty("quadx.log", "INFO").toUpperCase());
    } catch (IllegalArgumentException ex) {
      logger.warning(format(" Exception %s in parsing value of quadx.log", ex));
      level = Level.INFO;
    }
    origLevel = level;

    try {
      level = Level.parse(System.getProperty("quadx.test.log", "WARNING").toUpperCase());
    } catch (IllegalArgumentException ex) {
      logger.warning(format(" Exception %s in parsing value of quadx.test.log", ex));
      level = origLevel;
    }
    testLevel = level;
  }

  /** afterClass. */
  @AfterClass
  public static void afterClass() {
    Logger.getLogger("quadx").setLevel(origLevel);
    logger.setLevel(origLevel);
  }

  /** beforeClass. */
  @BeforeClass
  public static void beforeClass() {
    // Set appropriate logging levels for interior/exterior Loggers.
    Logger.getLogger("quadx").setLevel(testLevel);
    logger.setLevel(testLevel);
  }

  /** afterTest. */
  @After
  public void afterTest() {
    // All properties are set to the values they were at the beginning of the test.
    System.setProperties(properties);
  }

  /** beforeTest. */
  @Before
  public void beforeTest() {
    // New properties object that will hold the property key-value pairs that were present
    // at the beginning of the test.
    properties = new Properties();

    // currentProperties holds the properties at the beginning of the test.
    Properties currentProperties = System.getProperties();

    // All key-value pairs from currentProperties are stored in the properties object.
    currentProperties.stringPropertyNames()
        .forEach(key -> properties.setProperty(key, currentProperties.getProperty(key)));
  }
}

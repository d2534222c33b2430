// ******************************************************************************
//
// Title:       RIES.
// Description: RIES - Resonances Integrated over Energy and Space.
// Copyright:   Copyright (c) RIES Developers 2026.
//
// This file is part of RIES.
//
// RIES is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// RIES is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// RIES; if not, write to the Free Software Foundation, Inc., 59 Temple
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
package ries.utilities;

import static java.lang.String.format;

import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;

/**
 * The RiesTest configures the context for RIES tests. This includes:
 * <br>
 * 1) Configures the logging level, using the ries.test.log System property (default: WARNING).
 * <br>
 * 2) Stores System properties prior to each test, and restores them after each test (i.e. properties
 * set by a test do not effect the next test).
 */
public abstract class RiesTest {

  /** Constant <code>logger</code> */
  protected static final Logger logger = Logger.getLogger(RiesTest.class.getName());

  private static final Level origLevel;
  private static final Level testLevel;
  private static Properties properties;

  static {
    Level level;
    try {
      level = Level.parse(System.getProperty("ries.log", "INFO").toUpperCase());
    } catch (Exception ex) {
      logger.warning(format(" Exception %s in parsing value of ries.log", ex));
      level = Level.INFO;
    }
    origLevel = level;

    try {
      level = Level.parse(System.getProperty("ries.test.log", "WARNING").toUpperCase());
    } catch (Exception ex) {
      logger.warning(format(" Exception %s in parsing value of ries.test.log", ex));
      level = origLevel;
    }
    testLevel = level;
    System.setProperty("ries.log", testLevel.toString());
  }

  /** afterClass. */
  @AfterClass
  public static void afterClass() {
    Logger.getGlobal().setLevel(origLevel);
    Logger.getLogger("ries").setLevel(origLevel);
    logger.setLevel(origLevel);
  }

  /** beforeClass. */
  @BeforeClass
  public static void beforeClass() {
    // Set appropriate logging levels for interior/exterior Loggers.
    Logger.getGlobal().setLevel(testLevel);
    Logger.getLogger("ries").setLevel(testLevel);
    logger.setLevel(testLevel);
  }

  /**
   * Attach a collector to the logger of the given class. The collector is removed again by calling
   * {@link LogRecordCollector#close()}.
   *
   * @param loggingClass the class whose logger should be observed.
   * @return the attached collector.
   */
  public static LogRecordCollector collectWarnings(Class<?> loggingClass) {
    return LogRecordCollector.attach(Logger.getLogger(loggingClass.getName()), Level.WARNING);
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
    properties = new Properties();
    Properties currentProperties = System.getProperties();
    currentProperties.stringPropertyNames()
        .forEach(key -> properties.setProperty(key, currentProperties.getProperty(key)));
  }
}

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

import java.io.File;
import java.net.URL;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the numerical settings of RIES from a hierarchy of property sources.
 *
 * @since 1.0
 */
public class RiesProperties {

  private static final Logger logger = Logger.getLogger(RiesProperties.class.getName());

  /** Classpath location of the default properties. */
  public static final String DEFAULT_PROPERTIES = "ries/utilities/ries.properties";

  private RiesProperties() {}

  /** Holder of the shared properties, loaded on first use. */
  private static class SharedProperties {
    private static final CompositeConfiguration PROPERTIES = loadProperties();
  }

  /**
   * Properties shared by all components that are created with default settings. They are loaded
   * once, the first time this method is called.
   *
   * @return the shared CompositeConfiguration.
   * @see #loadProperties()
   */
  public static CompositeConfiguration getProperties() {
    return SharedProperties.PROPERTIES;
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   *
   * <p>1.) JVM system properties (e.g. -Dppf-max-evaluations=200).
   *
   * <p>2.) User specific properties in ~/.ries/ries.properties.
   *
   * <p>3.) System wide properties named by the environment variable RIES_PROPERTIES.
   *
   * <p>4.) Defaults bundled with the distribution.
   *
   * <p>Every call reads the property sources again.
   *
   * @return a populated CompositeConfiguration.
   */
  public static CompositeConfiguration loadProperties() {
    CompositeConfiguration properties = new CompositeConfiguration();

    // JVM system properties are read first.
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // User specific options are 2nd.
    String filename = System.getProperty("user.home") + File.separator + ".ries/ries.properties";
    File userPropFile = new File(filename);
    if (userPropFile.exists() && userPropFile.canRead()) {
      try {
        PropertiesConfiguration userConfiguration = loadFile(userPropFile);
        userConfiguration.setHeader("RIES user property file (" + filename + ").");
        properties.addConfiguration(userConfiguration);
      } catch (ConfigurationException e) {
        logger.log(Level.INFO, " Error loading {0}.", filename);
      }
    }

    // System wide options are 3rd.
    filename = System.getenv("RIES_PROPERTIES");
    if (filename != null) {
      File systemPropFile = new File(filename);
      if (systemPropFile.exists() && systemPropFile.canRead()) {
        try {
          PropertiesConfiguration envConfiguration = loadFile(systemPropFile);
          envConfiguration.setHeader("Environment variable RIES_PROPERTIES (" + filename + ").");
          properties.addConfiguration(envConfiguration);
        } catch (ConfigurationException e) {
          logger.log(Level.INFO, " Error loading {0}.", filename);
        }
      }
    }

    // Bundled defaults are last.
    URL url = RiesProperties.class.getClassLoader().getResource(DEFAULT_PROPERTIES);
    if (url != null) {
      try {
        FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
            new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
                .configure(new Parameters().properties().setURL(url).setIncludesAllowed(false));
        PropertiesConfiguration defaultConfiguration = builder.getConfiguration();
        defaultConfiguration.setHeader("RIES default properties (" + url + ").");
        properties.addConfiguration(defaultConfiguration);
      } catch (ConfigurationException e) {
        logger.log(Level.INFO, " Error loading {0}.", url);
      }
    } else {
      logger.info(" RIES default properties were not found on the classpath.");
    }

    return properties;
  }

  private static PropertiesConfiguration loadFile(File file) throws ConfigurationException {
    FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
        new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
            .configure(new Parameters().properties()
                .setFile(file)
                .setThrowExceptionOnMissing(true)
                .setIncludesAllowed(false));
    return builder.getConfiguration();
  }
}

// Copyright (c) 2001-2014 Genome Research Ltd.
//
// Authors: David Harper
//          Ed Zuiderwijk
//          Kate Taylor
//
// This file is part of Arcturus.
//
// Arcturus is free software: you can redistribute it and/or modify it under
// the terms of the GNU General Public License as published by the Free Software
// Foundation; either version 3 of the License, or (at your option) any later
// version.
//
// This program is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// this program. If not, see <http://www.gnu.org/licenses/>.

package uk.ac.sanger.hmmgraph;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import uk.ac.sanger.hmmgraph.logging.ShortMessageFormatter;

public class HMMGraph {
	protected static final String PROJECT_PROPERTIES_FILE = ".hmmgraph.props";
	protected static final String DEFAULT_PROPERTIES_RESOURCE = "/resources/hmmgraph.props";

	public static final String LOGGER_NAME = "uk.ac.sanger.hmmgraph";

	protected static Properties hmmgraphProps = new Properties(System.getProperties());
	protected static Logger logger = Logger.getLogger(LOGGER_NAME);

	static {
		loadProperties();
		initialiseLogging();
	}

	private static void loadProperties() {
		InputStream is = HMMGraph.class.getResourceAsStream(DEFAULT_PROPERTIES_RESOURCE);

		if (is != null) {
			try {
				hmmgraphProps.load(is);
				is.close();
			} catch (IOException ioe) {
				logger.log(Level.WARNING, "Failed to read " + DEFAULT_PROPERTIES_RESOURCE, ioe);
			}
		} else
			logger.warning("Unable to find the resource " + DEFAULT_PROPERTIES_RESOURCE
					+ ", using built-in defaults");

		// Project-specific settings override the defaults. Look for them by
		// walking up the directory tree from the current working directory.

		String cwd = System.getProperty("user.dir");

		File dir = cwd == null ? null : new File(cwd);

		boolean found = false;

		while (dir != null && !found) {
			File file = new File(dir, PROJECT_PROPERTIES_FILE);

			if (file.exists() && file.canRead()) {
				try {
					FileInputStream fis = new FileInputStream(file);
					hmmgraphProps.load(fis);
					fis.close();
					found = true;
				} catch (IOException ioe) {
					logger.log(Level.WARNING, "Failed to read " + file.getPath(), ioe);
					found = true;
				}
			} else
				dir = dir.getParentFile();
		}
	}

	private static void initialiseLogging() {
		logger.setUseParentHandlers(false);

		Level level = parseLevel(getProperty("hmmgraph.log.level"), Level.INFO);

		Handler console = new ConsoleHandler();

		console.setFormatter(new ShortMessageFormatter());
		console.setLevel(level);

		logger.addHandler(console);
		logger.setLevel(level);
	}

	private static Level parseLevel(String name, Level defaultLevel) {
		if (name == null)
			return defaultLevel;

		try {
			return Level.parse(name.trim().toUpperCase());
		} catch (IllegalArgumentException iae) {
			logger.warning("Unknown log level \"" + name + "\", using " + defaultLevel);
			return defaultLevel;
		}
	}

	public static Properties getProperties() {
		return hmmgraphProps;
	}

	public static String getProperty(String key) {
		return hmmgraphProps.getProperty(key);
	}

	public static Logger getLogger() {
		return logger;
	}

	public static boolean isLoggable(Level level) {
		return logger.isLoggable(level);
	}

	public static void log(Level level, String message, Throwable throwable) {
		logger.log(level, message, throwable);
	}

	public static void log(Level level, String message) {
		logger.log(level, message);
	}

	public static void logFine(String message) {
		logger.log(Level.FINE, message);
	}

	public static void logInfo(String message) {
		logger.log(Level.INFO, message);
	}

	public static void logWarning(String message) {
		logger.log(Level.WARNING, message);
	}

	public static void logWarning(Throwable throwable) {
		logger.log(Level.WARNING, throwable.getMessage(), throwable);
	}

	public static void logWarning(String message, Throwable throwable) {
		logger.log(Level.WARNING, message, throwable);
	}

	public static void logSevere(String message) {
		logger.log(Level.SEVERE, message);
	}

	public static void logSevere(Throwable throwable) {
		logger.log(Level.SEVERE, throwable.getMessage(), throwable);
	}

	public static void logSevere(String message, Throwable throwable) {
		logger.log(Level.SEVERE, message, throwable);
	}
}

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

package uk.ac.sanger.hmmgraph.logging;

import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/**
 * One-line console format: timestamp, level, short source class and message.
 * Exceptions get the throwable and the frames that belong to this project.
 */

public class ShortMessageFormatter extends Formatter {
	protected static final String PACKAGE_PREFIX = "uk.ac.sanger.hmmgraph";

	private final SimpleDateFormat dateFormat = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss");

	public String format(LogRecord record) {
		StringBuffer sb = new StringBuffer();

		formatForMessage(sb, record);

		if (record.getThrown() != null)
			formatForException(sb, record.getThrown());

		return sb.toString();
	}

	private void formatForMessage(StringBuffer sb, LogRecord record) {
		Date timestamp = new Date(record.getMillis());

		synchronized (dateFormat) {
			sb.append(dateFormat.format(timestamp));
		}

		sb.append(" ");
		sb.append(record.getLevel());
		sb.append(" [");
		sb.append(shortClassName(record.getSourceClassName()));
		sb.append("] ");
		sb.append(formatMessage(record));
		sb.append("\n");
	}

	private void formatForException(StringBuffer sb, Throwable throwable) {
		sb.append(throwable.getClass().getName() + ": "
				+ throwable.getMessage() + "\n");

		StackTraceElement[] ste = throwable.getStackTrace();

		boolean showAll = ste.length <= 10;

		for (int i = 0; i < ste.length; i++)
			if (showAll || ste[i].getClassName().startsWith(PACKAGE_PREFIX))
				sb.append("  [" + i + "]: " + ste[i] + "\n");

		Throwable cause = throwable.getCause();

		if (cause != null) {
			sb.append("CAUSE: " + cause.getClass().getName() + " : " + cause.getMessage() + "\n");

			ste = cause.getStackTrace();

			for (int i = 0; i < ste.length; i++)
				if (ste[i].getClassName().startsWith(PACKAGE_PREFIX))
					sb.append("  [" + i + "]: " + ste[i] + "\n");
		}
	}

	protected static String shortClassName(String className) {
		if (className == null)
			return "?";

		int dot = className.lastIndexOf('.');

		return dot < 0 ? className : className.substring(dot + 1);
	}
}

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

package uk.ac.sanger.hmmgraph.fasta;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Reads DNA or protein sequences in FASTA format. The name of a sequence is
 * the first word of its header line. Blank lines are skipped.
 */

public class FastaFileReader {
	private static final String FASTA_PREFIX = ">";

	private static final String SEQUENCE_PATTERN = "^[A-Za-z*\\-]+$";

	public void processFile(File file, SequenceProcessor processor) throws IOException,
			FastaFileException {
		FileInputStream fis = new FileInputStream(file);

		try {
			processFile(fis, processor);
		} finally {
			fis.close();
		}
	}

	public void processFile(InputStream is, SequenceProcessor processor) throws IOException,
			FastaFileException {
		BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.US_ASCII));

		StringBuilder sb = null;

		String seqname = null;

		String line;

		int lineNumber = 0;

		while ((line = br.readLine()) != null) {
			lineNumber++;

			line = line.trim();

			if (line.length() == 0)
				continue;

			if (line.startsWith(FASTA_PREFIX)) {
				if (seqname != null)
					processSequence(processor, seqname, sb.toString());

				String[] words = line.substring(1).trim().split("\\s+");

				if (words[0].length() == 0)
					throw new FastaFileException("Sequence header has no name", lineNumber);

				seqname = words[0];

				sb = new StringBuilder();
			} else if (seqname == null) {
				throw new FastaFileException("Sequence data before the first header", lineNumber);
			} else if (line.matches(SEQUENCE_PATTERN)) {
				sb.append(line);
			} else
				throw new FastaFileException("Invalid sequence data \"" + line + "\"", lineNumber);
		}

		if (seqname != null)
			processSequence(processor, seqname, sb.toString());
	}

	private void processSequence(SequenceProcessor processor, String seqname, String sequence) {
		if (processor != null)
			processor.processSequence(seqname, sequence);
	}
}

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

package uk.ac.sanger.hmmgraph.apps;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import uk.ac.sanger.hmmgraph.HMMGraph;
import uk.ac.sanger.hmmgraph.depth.DepthSubset;
import uk.ac.sanger.hmmgraph.fasta.FastaFileException;
import uk.ac.sanger.hmmgraph.fasta.FastaFileReader;
import uk.ac.sanger.hmmgraph.fasta.SequenceProcessor;
import uk.ac.sanger.hmmgraph.fees.Alphabet;
import uk.ac.sanger.hmmgraph.fees.Fees;
import uk.ac.sanger.hmmgraph.fees.ScoringMatrix;
import uk.ac.sanger.hmmgraph.fees.SequenceProfileBuilder;
import uk.ac.sanger.hmmgraph.graph.SequenceGraph;
import uk.ac.sanger.hmmgraph.graph.SequenceGraphCursor;
import uk.ac.sanger.hmmgraph.hmmpath.HMMPathFinder;
import uk.ac.sanger.hmmgraph.hmmpath.SearchParameters;
import uk.ac.sanger.hmmgraph.pathtree.AnnotatedPath;
import uk.ac.sanger.hmmgraph.pathtree.PathSet;

public class AlignSequenceToGraph {
	private static final int DEFAULT_OVERLAP = 0;
	private static final int DEFAULT_TOP = 1;

	public static void main(String[] args) {
		String queryFilename = null;
		String graphFilename = null;
		String linksFilename = null;
		int overlap = DEFAULT_OVERLAP;
		int top = DEFAULT_TOP;
		Double threshold = null;
		boolean protein = false;
		List<String> seeds = new ArrayList<String>();

		int match = ScoringMatrix.DEFAULT_MATCH_SCORE;
		int mismatch = ScoringMatrix.DEFAULT_MISMATCH_PENALTY;
		int gapInit = ScoringMatrix.DEFAULT_GAP_INIT_PENALTY;
		int gapExtend = ScoringMatrix.DEFAULT_GAP_EXTEND_PENALTY;

		try {
			for (int i = 0; i < args.length; i++) {
				if (args[i].equalsIgnoreCase("-query"))
					queryFilename = args[++i];
				else if (args[i].equalsIgnoreCase("-graph"))
					graphFilename = args[++i];
				else if (args[i].equalsIgnoreCase("-links"))
					linksFilename = args[++i];
				else if (args[i].equalsIgnoreCase("-overlap"))
					overlap = Integer.parseInt(args[++i]);
				else if (args[i].equalsIgnoreCase("-top"))
					top = Integer.parseInt(args[++i]);
				else if (args[i].equalsIgnoreCase("-threshold"))
					threshold = Double.valueOf(args[++i]);
				else if (args[i].equalsIgnoreCase("-match"))
					match = Integer.parseInt(args[++i]);
				else if (args[i].equalsIgnoreCase("-mismatch"))
					mismatch = Integer.parseInt(args[++i]);
				else if (args[i].equalsIgnoreCase("-gapinit"))
					gapInit = Integer.parseInt(args[++i]);
				else if (args[i].equalsIgnoreCase("-gapextend"))
					gapExtend = Integer.parseInt(args[++i]);
				else if (args[i].equalsIgnoreCase("-seed"))
					seeds.add(args[++i]);
				else if (args[i].equalsIgnoreCase("-protein"))
					protein = true;
				else if (args[i].equalsIgnoreCase("-dna"))
					protein = false;
				else {
					System.err.println("Unknown option: " + args[i]);
					printUsage(System.err);
					System.exit(1);
				}
			}
		} catch (NumberFormatException nfe) {
			System.err.println("Invalid numeric value: " + nfe.getMessage());
			printUsage(System.err);
			System.exit(1);
		} catch (ArrayIndexOutOfBoundsException aioobe) {
			System.err.println("Missing value for the final option");
			printUsage(System.err);
			System.exit(1);
		}

		if (queryFilename == null || graphFilename == null) {
			printUsage(System.err);
			System.exit(1);
		}

		try {
			String query = loadQuery(new File(queryFilename));

			SequenceGraph graph = loadGraph(new File(graphFilename), overlap);

			if (linksFilename != null)
				loadLinks(new File(linksFilename), graph);

			HMMGraph.logInfo("Loaded " + graph.getSequenceCount() + " sequences and "
					+ graph.getLinkCount() + " links");

			Alphabet alphabet = protein ? Alphabet.AMINO_ACIDS : Alphabet.DNA;

			ScoringMatrix smat = new ScoringMatrix(match, mismatch, gapInit, gapExtend);

			Fees fees = new SequenceProfileBuilder(alphabet, smat).build(query);

			SearchParameters parameters = SearchParameters.fromProperties();

			if (threshold != null)
				parameters.setAbsoluteThreshold(threshold.doubleValue());

			HMMPathFinder<SequenceGraphCursor> finder = new HMMPathFinder<SequenceGraphCursor>(
					graph.emptyCursor(), parameters);

			Collection<SequenceGraphCursor> initial = selectSeeds(graph, seeds);

			HMMGraph.logInfo("Starting from " + initial.size() + " graph positions");

			PathSet<SequenceGraphCursor> result = finder.findBestPath(fees, initial);

			report(result, top, System.out);
		} catch (IOException ioe) {
			HMMGraph.logSevere("Failed to read input", ioe);
			System.exit(1);
		} catch (FastaFileException ffe) {
			HMMGraph.logSevere("Invalid FASTA input", ffe);
			System.exit(1);
		} catch (IllegalArgumentException iae) {
			HMMGraph.logSevere("Invalid input", iae);
			System.exit(1);
		}
	}

	private static void report(PathSet<SequenceGraphCursor> result, int top, PrintStream ps) {
		if (result.isEmpty()) {
			ps.println("No alignment found");
			return;
		}

		List<AnnotatedPath<SequenceGraphCursor>> paths = result.topK(top);

		for (int i = 0; i < paths.size(); i++) {
			AnnotatedPath<SequenceGraphCursor> path = paths.get(i);

			if (i > 0)
				ps.println();

			ps.println("Score: " + path.getScore());
			ps.println("Walk: " + path.getCursors());
			ps.println("Sequence: " + path.getSequence());
			ps.println("Alignment: " + path.getAlignment());
			ps.println("CIGAR: " + path.getCigar());
		}
	}

	private static String loadQuery(File file) throws IOException, FastaFileException {
		final List<String> sequences = new ArrayList<String>();

		new FastaFileReader().processFile(file, new SequenceProcessor() {
			public void processSequence(String name, String sequence) {
				sequences.add(sequence);
			}
		});

		if (sequences.isEmpty())
			throw new IllegalArgumentException("No query sequence in " + file);

		if (sequences.size() > 1)
			HMMGraph.logWarning("Using only the first of " + sequences.size()
					+ " sequences in " + file);

		return sequences.get(0);
	}

	private static SequenceGraph loadGraph(File file, int overlap) throws IOException,
			FastaFileException {
		final SequenceGraph graph = new SequenceGraph(overlap);

		new FastaFileReader().processFile(file, new SequenceProcessor() {
			public void processSequence(String name, String sequence) {
				graph.addSequence(name, sequence);
			}
		});

		return graph;
	}

	private static void loadLinks(File file, SequenceGraph graph) throws IOException {
		FileInputStream fis = new FileInputStream(file);

		try {
			loadLinks(fis, graph);
		} finally {
			fis.close();
		}
	}

	static void loadLinks(InputStream is, SequenceGraph graph) throws IOException {
		BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.US_ASCII));

		try {
			String line;

			while ((line = br.readLine()) != null) {
				line = line.trim();

				if (line.length() == 0 || line.startsWith("#"))
					continue;

				String[] words = line.split("\\s+");

				if (words.length < 2)
					throw new IllegalArgumentException("Expected two sequence names in \"" + line
							+ "\"");

				graph.addLink(words[0], words[1]);
			}
		} finally {
			br.close();
		}
	}

	/**
	 * Returns every graph position within reach of the given seeds, each
	 * written as <code>name:offset:depth</code>, or every graph position if
	 * there are no seeds.
	 */

	static Collection<SequenceGraphCursor> selectSeeds(SequenceGraph graph, List<String> seeds) {
		if (seeds.isEmpty())
			return graph.allCursors();

		List<SequenceGraphCursor> cursors = new ArrayList<SequenceGraphCursor>();
		List<Integer> depths = new ArrayList<Integer>();

		for (String seed : seeds) {
			String[] words = seed.split(":");

			if (words.length != 3)
				throw new IllegalArgumentException("Expected name:offset:depth but got \"" + seed
						+ "\"");

			try {
				cursors.add(graph.cursorAt(words[0], Integer.parseInt(words[1])));
				depths.add(Integer.valueOf(words[2]));
			} catch (NumberFormatException nfe) {
				throw new IllegalArgumentException("Invalid seed \"" + seed + "\"", nfe);
			}
		}

		return DepthSubset.depthSubset(cursors, depths, true);
	}

	private static void printUsage(PrintStream ps) {
		ps.println("MANDATORY PARAMETERS");
		ps.println("\t-query\t\tName of query FASTA file");
		ps.println("\t-graph\t\tName of FASTA file with one sequence per graph vertex");
		ps.println();
		ps.println("OPTIONAL PARAMETERS WHICH CONTROL THE GRAPH");
		ps.println("\t-links\t\tName of file with one link per line: from to");
		ps.println("\t-overlap\tSymbols shared by linked sequences [default: " + DEFAULT_OVERLAP
				+ "]");
		ps.println("\t-dna\t\tSequences are DNA [default]");
		ps.println("\t-protein\tSequences are protein");
		ps.println();
		ps.println("OPTIONAL PARAMETERS WHICH CONTROL PROCESSING");
		ps.println("\t-seed\t\tStart only within depth of name:offset:depth, may be repeated");
		ps.println("\t\t\t[default: start anywhere in the graph]");
		ps.println("\t-threshold\tAbsolute score threshold [default: "
				+ SearchParameters.DEFAULT_ABSOLUTE_THRESHOLD + "]");
		ps.println("\t-match\t\tMatch score [default: " + ScoringMatrix.DEFAULT_MATCH_SCORE + "]");
		ps.println("\t-mismatch\tMismatch penalty [default: "
				+ ScoringMatrix.DEFAULT_MISMATCH_PENALTY + "]");
		ps.println("\t-gapinit\tGap opening penalty [default: "
				+ ScoringMatrix.DEFAULT_GAP_INIT_PENALTY + "]");
		ps.println("\t-gapextend\tGap extension penalty [default: "
				+ ScoringMatrix.DEFAULT_GAP_EXTEND_PENALTY + "]");
		ps.println();
		ps.println("OPTIONAL PARAMETERS WHICH CONTROL OUTPUT");
		ps.println("\t-top\t\tNumber of alignments to write [default: " + DEFAULT_TOP + "]");
	}
}

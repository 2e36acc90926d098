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

package uk.ac.sanger.hmmgraph.fees;

import java.util.Arrays;

/**
 * Maps symbols to emission-table indices. Lower and upper case are the same
 * symbol. Every symbol outside the alphabet maps to one extra index, so an
 * emission vector has <code>size() + 1</code> entries.
 */

public class Alphabet {
	public static final Alphabet DNA = new Alphabet("ACGT");
	public static final Alphabet AMINO_ACIDS = new Alphabet("ACDEFGHIKLMNPQRSTVWY");

	private final String symbols;
	private final int[] codes = new int[128];

	public Alphabet(String symbols) {
		this.symbols = symbols.toUpperCase();

		Arrays.fill(codes, this.symbols.length());

		for (int i = 0; i < this.symbols.length(); i++) {
			char c = this.symbols.charAt(i);

			if (c >= 128)
				throw new IllegalArgumentException("Only ASCII symbols are supported");

			if (codes[c] != this.symbols.length())
				throw new IllegalArgumentException("Duplicate symbol " + c);

			codes[c] = i;
			codes[Character.toLowerCase(c)] = i;
		}
	}

	public int size() {
		return symbols.length();
	}

	/**
	 * The length of an emission vector over this alphabet.
	 */

	public int getEmissionVectorLength() {
		return symbols.length() + 1;
	}

	public int code(char symbol) {
		return symbol < 128 ? codes[symbol] : symbols.length();
	}

	public int getUnknownCode() {
		return symbols.length();
	}

	public boolean contains(char symbol) {
		return code(symbol) != symbols.length();
	}

	public char symbol(int code) {
		return symbols.charAt(code);
	}

	public String getSymbols() {
		return symbols;
	}

	public String toString() {
		return "Alphabet[" + symbols + "]";
	}
}

package blockmat.matrixlib;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import blockmat.mathgenerics.BigIntegerRing;
import blockmat.mathgenerics.DoubleField;
import blockmat.mathgenerics.ModularRing;
import blockmat.mathgenerics.Ring;


// Reads and writes MatrixMarket coordinate files into matrices over a ring of choice.
// Layout: an optional "%%MatrixMarket matrix coordinate <field> <symmetry>" banner, further "%" comment lines,
// a size line "rows cols entries", then one "row col value" line per entry with 1-based indexes.
// Fields real, integer, pattern and the nonstandard "rational" (values p/q) are accepted, values are parsed by the ring.
// Symmetries general, symmetric and skew-symmetric are accepted.
public final class MatrixMarketIO {

	private static final int GENERAL = 0, SYMMETRIC = 1, SKEW = 2;

	private MatrixMarketIO() {}

	public static <R> Matrix<R> read(Path file, Ring<R> ring) throws IOException {
		String fName = file.getFileName().toString();
		int dot = fName.lastIndexOf('.');
		try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return read(in, ring, dot > 0 ? fName.substring(0, dot) : fName);
		}
	}


	public static <R> Matrix<R> read(Reader reader, Ring<R> ring, String name) throws IOException {

		BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
		int state = 1, lineNo = 0, symmetry = GENERAL, entries = 0, read = 0;
		boolean pattern = false;
		Matrix<R> A = null;
		String s;

		while ((s = br.readLine()) != null) {
			lineNo++;
			String line = s.trim();

			// the banner is only recognised on the first line
			if (lineNo == 1 && line.startsWith("%%MatrixMarket")) {
				String[] banner = line.toLowerCase().split("\\s+");
				if (banner.length < 5 || !banner[1].equals("matrix"))
					throw invalid(lineNo, "Malformed banner");
				if (!banner[2].equals("coordinate"))
					throw invalid(lineNo, "Only the coordinate format is supported, found \"" + banner[2] + "\"");
				if (banner[3].equals("complex"))
					throw invalid(lineNo, "Complex matrices are not supported");
				pattern = banner[3].equals("pattern");
				if (banner[4].equals("symmetric"))				symmetry = SYMMETRIC;
				else if (banner[4].equals("skew-symmetric"))	symmetry = SKEW;
				else if (!banner[4].equals("general"))
					throw invalid(lineNo, "Unsupported symmetry \"" + banner[4] + "\"");
				continue;
			}
			// skip all commenting and empty lines
			if (line.isEmpty() || line.startsWith("%")) continue;
			String[] tok = line.split("\\s+");

			switch (state) {

			// state 1 takes care of the size line and allocates the matrix
			case 1:
				if (tok.length != 3) throw invalid(lineNo, "Size line needs rows, columns and entry count");
				int rows = parseInt(tok[0], lineNo), cols = parseInt(tok[1], lineNo);
				entries = parseInt(tok[2], lineNo);
				if (rows < 0 || cols < 0 || entries < 0) throw invalid(lineNo, "Invalid header");
				if (symmetry != GENERAL && rows != cols) throw invalid(lineNo, "Symmetric matrix must be square");
				A = new Matrix<R>(name, ring, rows, cols);
				state = 2;
				break;

			// state 2 reads in the coordinate entries
			case 2:
				if (read == entries) throw invalid(lineNo, "More entries than announced (" + entries + ")");
				if (tok.length != (pattern ? 2 : 3)) throw invalid(lineNo, "Invalid data row");
				int r = parseInt(tok[0], lineNo) - 1, c = parseInt(tok[1], lineNo) - 1;
				if (r < 0 || r >= A.M || c < 0 || c >= A.N)
					throw invalid(lineNo, "Entry (" + (r + 1) + "," + (c + 1) + ") outside " + A.M + "x" + A.N);
				R v;
				try { v = pattern ? ring.one() : ring.parse(tok[2]);
				} catch (NumberFormatException e) {
					throw new InvalidInputException("MatrixMarketIO.read(): Line " + lineNo + ": " + e.getMessage(), e);
				}
				A.valueTo(r, c, v);
				if (r != c && symmetry == SYMMETRIC)	A.valueTo(c, r, v);
				if (r != c && symmetry == SKEW)			A.valueTo(c, r, ring.negate(v));
				read++;
				break;

			default:
				throw new IllegalStateException("MatrixMarketIO.read(): Unknown state " + state + ".");
			}
		}

		if (A == null) throw invalid(lineNo, "Missing size line");
		if (read != entries) throw invalid(lineNo, "Found " + read + " entries, announced " + entries);
		if (Matrix.DEBUG_LEVEL > 1) System.out.println(A.toString());
		return A;
	}


	// writes the nonzero entries of a matrix in general coordinate format
	public static <R> void write(Matrix<R> A, Writer out) throws IOException {

		Ring<R> ring = A.ring;
		int nz = 0;
		for (int i = 0; i < A.M; i++)
			for (int j = 0; j < A.N; j++) if (!A.isZeroAt(i, j)) nz++;

		out.write("%%MatrixMarket matrix coordinate " + fieldOf(ring) + " general\n");
		out.write("% " + A.name + " over " + ring.name() + "\n");
		out.write(A.M + " " + A.N + " " + nz + "\n");
		for (int i = 0; i < A.M; i++)
			for (int j = 0; j < A.N; j++) {
				R v = A.valueOf(i, j);
				if (ring.isZero(v)) continue;
				String text = v instanceof Double ? v.toString() : ring.format(v);	// full precision for reals
				out.write((i + 1) + " " + (j + 1) + " " + text + "\n");
			}
		out.flush();
	}

	private static String fieldOf(Ring<?> ring) {
		if (ring instanceof DoubleField) return "real";
		if (ring instanceof BigIntegerRing || ring instanceof ModularRing) return "integer";
		return "rational";
	}

	private static int parseInt(String s, int lineNo) {
		try { return Integer.parseInt(s);
		} catch (NumberFormatException e) {
			throw new InvalidInputException("MatrixMarketIO.read(): Line " + lineNo + ": Not an integer \"" + s + "\".", e);
		}
	}

	private static InvalidInputException invalid(int lineNo, String message) {
		return new InvalidInputException("MatrixMarketIO.read(): Line " + lineNo + ": " + message + ".");
	}
}

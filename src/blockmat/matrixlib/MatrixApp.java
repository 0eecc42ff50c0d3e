package blockmat.matrixlib;

import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.io.PrintStream;
import java.math.BigInteger;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Random;
import java.util.SortedMap;

import org.jfree.data.xy.XYDataset;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.jfree.ui.RefineryUtilities;

import blockmat.mathgenerics.BigIntegerRing;
import blockmat.mathgenerics.DoubleField;
import blockmat.mathgenerics.ModularRing;
import blockmat.mathgenerics.Rational;
import blockmat.mathgenerics.RationalField;
import blockmat.mathgenerics.Ring;
import blockmat.mathgenerics.XYLineChart_AWT;


// Command line driver:
//		demo							worked examples of the block engines
//		bench [maxSize] [labels]		times kernel against block engines over Q and charts the result
//		file <path> [Z|Q|R|Z/p]			reads a MatrixMarket file, labels its block structure, prints the determinant
public class MatrixApp {

	final static int PRERUNS = 3, ITERATIONS = 5;
	final static String[] TEST_NAMES = { "kernel det", "block det", "kernel inverse", "block inverse" };

	public static void main(String[] args) throws IOException {

		String mode = args.length > 0 ? args[0] : "demo";
		switch (mode) {
		case "demo":
			demo(System.out);
			break;

		case "bench":
			int maxSize = args.length > 1 ? Integer.parseInt(args[1]) : 40;
			int labels = args.length > 2 ? Integer.parseInt(args[2]) : 4;
			int[] sizes = new int[(maxSize - 2) / 2 + 1];
			for (int i = 0; i < sizes.length; i++) sizes[i] = 2 + i * 2;
			double[][] timings = benchmark(sizes, labels, RationalField.INSTANCE, ITERATIONS, new Random(1));
			printTimings(System.out, timings, sizes);
			showChart(timings, sizes, labels);
			break;

		case "file":
			if (args.length < 2) { usage(); return; }
			reportFile(args[1], parseRing(args.length > 2 ? args[2] : "Q"), System.out);
			break;

		default:
			usage();
		}
	}

	private static void usage() {
		System.err.println("usage: MatrixApp demo | bench [maxSize] [labels] | file <path> [Z|Q|R|Z/p]");
	}

	static Ring<?> parseRing(String token) {
		if (token.equals("Z")) return BigIntegerRing.INSTANCE;
		if (token.equals("Q")) return RationalField.INSTANCE;
		if (token.equals("R")) return DoubleField.INSTANCE;
		if (token.startsWith("Z/")) return new ModularRing(Long.parseLong(token.substring(2)));
		throw new IllegalArgumentException("MatrixApp.parseRing(): Unknown ring \"" + token + "\".");
	}


	///////////////////////////////////////////////////////////////////////////////////////////////////////////
	//			DEMO
	///////////////////////////////////////////////////////////////////////////////////////////////////////////

	public static void demo(PrintStream out) {

		Ring<BigInteger> Z = BigIntegerRing.INSTANCE;

		// every index its own label: plain upper triangular matrix
		Matrix<BigInteger> T = Matrix.fromLongs("T", Z, new long[][] {
			{ 2, 7, 1 },
			{ 0, 3, 4 },
			{ 0, 0, 5 } });
		Labelling<Integer> b1 = ArrayLabelling.ofInts(1, 2, 3);
		out.println(T.toString());
		out.println("labels " + b1 + ", block triangular determinant: " + BlockTriangularDeterminant.det(T, b1));
		out.println();

		// two 2x2 diagonal blocks over Q
		Matrix<Rational> B = Matrix.fromLongs("B", RationalField.INSTANCE, new long[][] {
			{ 4, 7, 1, 2 },
			{ 2, 6, 3, 1 },
			{ 0, 0, 1, 2 },
			{ 0, 0, 3, 4 } });
		Labelling<Integer> b2 = ArrayLabelling.ofInts(0, 0, 1, 1);
		out.println(B.toString());
		out.println("labels " + b2 + ", determinant " + BlockTriangularDeterminant.det(B, b2) + ", inverse:");
		out.println(BlockTriangularInverse.invert(B, b2).toString());

		// structure discovery: the labeller finds the blocks of a matrix that only looks dense
		Matrix<BigInteger> S = Matrix.fromLongs("S", Z, new long[][] {
			{ 1, 0, 2, 0, 1 },
			{ 3, 1, 1, 0, 1 },
			{ 0, 0, 1, 0, 4 },
			{ 5, 2, 1, 2, 1 },
			{ 0, 0, 1, 0, 3 } });
		Labelling<Integer> found = BlockLabeller.label(S);
		out.println(S.toString());
		SortedMap<Integer, BigInteger> dets = BlockTriangularDeterminant.diagonalBlockDeterminants(S, found);
		out.println("labeller found " + ArrayLabelling.copyOf(found, S.rows()) + ", block determinants " + dets
				+ ", determinant " + BlockTriangularDeterminant.det(S, found)
				+ " (kernel: " + ScalarBlockKernel.det(S) + ")");
	}


	///////////////////////////////////////////////////////////////////////////////////////////////////////////
	//			BENCHMARK
	///////////////////////////////////////////////////////////////////////////////////////////////////////////

	// average nanoseconds per operation: result[test][sizeIndex], tests ordered as TEST_NAMES
	public static <R> double[][] benchmark(int[] sizes, int labelCount, Ring<R> ring, int iterations, Random rnd) {

		double[][] testRuns = new double[TEST_NAMES.length][sizes.length];
		int debuglevel = Matrix.DEBUG_LEVEL;
		Matrix.DEBUG_LEVEL = 0;			// no output to console during tests

		try {
			// the preruns are supposed to warm up the JVM
			for (int pre = PRERUNS, s = 0; s < sizes.length; s++) {
				int n = sizes[s];
				int[] labels = RandomBlockTriangular.randomLabels(n, Math.min(labelCount, Math.max(n, 1)), rnd);
				Labelling<Integer> b = ArrayLabelling.ofInts(labels);
				Matrix<R> A = RandomBlockTriangular.generate("A", ring, labels, 0.5, 5, true, rnd);

				for (int test = 0; test < TEST_NAMES.length; test++) {
					long start = System.nanoTime();
					for (int i = 0; i < iterations; i++)
						switch (test) {
						case 0:	ScalarBlockKernel.det(A); break;
						case 1:	BlockTriangularDeterminant.det(A, b, BlockTriangularDeterminant.LabelOrder.DESCENDING, false); break;
						case 2:	ScalarBlockKernel.inverseOrThrow(A); break;
						case 3:	BlockTriangularInverse.invert(A, b, false); break;
						}
					testRuns[test][s] = (System.nanoTime() - start) / (double) iterations;
				}
				if (--pre > 0) s--;
			}
		} finally {
			Matrix.DEBUG_LEVEL = debuglevel;
		}
		return testRuns;
	}

	// chart data from the timings of the compared operations, one series per operation over the matrix sizes
	static XYDataset createStatisticSet(double[][] timingLists, String[] testNames, int[] sizes) {
		if (timingLists.length != testNames.length)
			throw new IllegalArgumentException("MatrixApp.createStatisticSet(): One name per timing list expected.");
		final XYSeriesCollection dataset = new XYSeriesCollection();
		for (int j = 0; j < timingLists.length; j++) {
			final XYSeries testSeries = new XYSeries(testNames[j], false);
			for (int i = 0; i < sizes.length; i++) testSeries.add(sizes[i], timingLists[j][i]);
			dataset.addSeries(testSeries);
		}
		return dataset;
	}

	static void printTimings(PrintStream out, double[][] timings, int[] sizes) {
		out.println("size  " + Arrays.toString(TEST_NAMES) + " (microseconds)");
		for (int s = 0; s < sizes.length; s++) {
			StringBuilder sb = new StringBuilder(String.format("%4d ", sizes[s]));
			for (double[] t : timings) sb.append(String.format("%14.1f", t[s] / 1000.0));
			out.println(sb.toString());
		}
	}

	private static void showChart(double[][] timings, int[] sizes, int labels) {
		if (GraphicsEnvironment.isHeadless()) return;
		XYDataset timingSet = createStatisticSet(timings, TEST_NAMES, sizes);
		XYLineChart_AWT chart = new XYLineChart_AWT("Block triangular engines, " + labels + " labels",
				"matrix size", "nanosecs/matrix op.", timingSet, 1024, 768);
		chart.pack();
		RefineryUtilities.centerFrameOnScreen(chart);
		chart.setVisible(true);
	}


	///////////////////////////////////////////////////////////////////////////////////////////////////////////
	//			FILE REPORT
	///////////////////////////////////////////////////////////////////////////////////////////////////////////

	static <R> void reportFile(String fileName, Ring<R> ring, PrintStream out) throws IOException {
		Matrix<R> A = MatrixMarketIO.read(Paths.get(fileName), ring);
		int[] labels = BlockLabeller.labels(A);
		Labelling<Integer> b = ArrayLabelling.ofInts(labels);
		int blocks = LabelPartition.of(A.rows(), b).labelCount();
		out.println(A.getName() + ": " + A.rows() + "x" + A.cols() + " over " + ring.name() + ", " + blocks + " diagonal blocks");
		out.println("determinant: " + ring.format(BlockTriangularDeterminant.det(A, b)));
	}
}

package blockmat.matrixlib;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Random;

import org.jfree.data.xy.XYDataset;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import blockmat.mathgenerics.BigIntegerRing;
import blockmat.mathgenerics.ModularRing;
import blockmat.mathgenerics.RationalField;

public class MatrixAppTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static String capture(ByteArrayOutputStream bytes) {
		return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void testDemo() {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		MatrixApp.demo(new PrintStream(bytes, true));
		String out = capture(bytes);
		assertTrue(out, out.contains("block triangular determinant: 30"));
		assertTrue(out, out.contains("determinant -20, inverse:"));
		assertTrue(out, out.contains("determinant -2 (kernel: -2)"));
	}

	@Test
	public void testBenchmark() {
		int debugLevel = Matrix.DEBUG_LEVEL;
		int[] sizes = { 2, 4, 6 };
		double[][] timings = MatrixApp.benchmark(sizes, 2, RationalField.INSTANCE, 1, new Random(3));
		assertEquals(MatrixApp.TEST_NAMES.length, timings.length);
		for (double[] t : timings) {
			assertEquals(sizes.length, t.length);
			for (double v : t) assertTrue(v >= 0);
		}
		assertEquals(debugLevel, Matrix.DEBUG_LEVEL);
	}

	@Test
	public void testStatisticSet() {
		double[][] timings = { { 1, 2 }, { 3, 4 }, { 5, 6 }, { 7, 8 } };
		XYDataset set = MatrixApp.createStatisticSet(timings, MatrixApp.TEST_NAMES, new int[] { 10, 20 });
		assertEquals(4, set.getSeriesCount());
		assertEquals(2, set.getItemCount(3));
		assertEquals(20.0, set.getXValue(3, 1), 0);
		assertEquals(8.0, set.getYValue(3, 1), 0);
	}

	@Test
	public void testParseRing() {
		assertSame(BigIntegerRing.INSTANCE, MatrixApp.parseRing("Z"));
		assertSame(RationalField.INSTANCE, MatrixApp.parseRing("Q"));
		assertEquals(5, ((ModularRing) MatrixApp.parseRing("Z/5")).modulus());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownRing() {
		MatrixApp.parseRing("C");
	}

	@Test
	public void testReportFile() throws IOException {
		File f = folder.newFile("tri.mtx");
		Files.write(f.toPath(), "%%MatrixMarket matrix coordinate integer general\n2 2 3\n1 1 2\n1 2 1\n2 2 3\n"
				.getBytes(StandardCharsets.UTF_8));
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		MatrixApp.reportFile(f.getPath(), BigIntegerRing.INSTANCE, new PrintStream(bytes, true));
		String out = capture(bytes);
		assertTrue(out, out.contains("2 diagonal blocks"));
		assertTrue(out, out.contains("determinant: 6"));
	}
}

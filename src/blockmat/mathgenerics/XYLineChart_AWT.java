package blockmat.mathgenerics;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Dimension;

import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartPanel;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.xy.XYDataset;
import org.jfree.ui.ApplicationFrame;

// Line chart window for benchmark timings, one series per timed operation
public class XYLineChart_AWT extends ApplicationFrame
{
	private static final long serialVersionUID = -3401891241593865248L;
	private static final Color[] SERIES_PAINT = { Color.BLACK, Color.BLUE, Color.RED, Color.GREEN, Color.ORANGE, Color.MAGENTA };

	public XYLineChart_AWT(String title, String xtag, String ytag, XYDataset dataset, int width, int height)
	{
		super(title);
		JFreeChart xylineChart = ChartFactory.createXYLineChart(
				title, xtag, ytag, dataset, PlotOrientation.VERTICAL, true, true, false);

		ChartPanel chartPanel = new ChartPanel(xylineChart);
		chartPanel.setPreferredSize(new Dimension(width, height));
		final XYPlot plot = xylineChart.getXYPlot();
		XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
		for (int s = 0; s < dataset.getSeriesCount(); s++) {
			renderer.setSeriesPaint(s, SERIES_PAINT[s % SERIES_PAINT.length]);
			renderer.setSeriesStroke(s, new BasicStroke(2));
		}
		plot.setRenderer(renderer);
		setContentPane(chartPanel);
	}
}

package com.autods.core.evaluation;

import com.autods.core.error.StorageException;
import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.CategoryChart;
import org.knowm.xchart.CategoryChartBuilder;
import org.knowm.xchart.CategorySeries;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Draws a confusion matrix as a grouped bar chart: one bar group per actual
 * class, one series per predicted class.
 */
@Component
public class ConfusionMatrixRenderer {

    static final int WIDTH = 600;
    static final int HEIGHT = 600;

    public void render(String title, List<String> labels, List<List<Integer>> confusion, Path target) {
        List<String> axis = displayLabels(labels);
        CategoryChart chart = new CategoryChartBuilder()
                .width(WIDTH)
                .height(HEIGHT)
                .title(title)
                .xAxisTitle("Actual")
                .yAxisTitle("Count")
                .build();

        for (int p = 0; p < axis.size(); p++) {
            List<Integer> column = new ArrayList<>(axis.size());
            for (int a = 0; a < axis.size(); a++) {
                column.add(confusion.get(a).get(p));
            }
            chart.addSeries("Predicted " + axis.get(p), axis, column);
        }
        chart.getStyler().setLegendVisible(true);
        chart.getStyler().setChartBackgroundColor(Color.WHITE);
        chart.getStyler().setDefaultSeriesRenderStyle(CategorySeries.CategorySeriesRenderStyle.Bar);

        try (OutputStream out = Files.newOutputStream(target)) {
            BitmapEncoder.saveBitmap(chart, out, BitmapEncoder.BitmapFormat.PNG);
        } catch (IOException e) {
            throw new StorageException("Cannot write confusion matrix to " + target, e);
        }
    }

    private static List<String> displayLabels(List<String> labels) {
        List<String> display = new ArrayList<>(labels.size());
        for (String label : labels) {
            display.add(label == null || label.isBlank() ? "(blank)" : label);
        }
        return display;
    }
}

package com.bubblegrade.service.omr;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Geometry and marking rules of an answer grid: bubbles are grouped into question rows from top to
 * bottom and each row is read left to right as choices A, B, C and so on.
 */
final class BubbleGrid {

    static final String NO_ANSWER = "";

    private BubbleGrid() {
    }

    record Circle(double x, double y, double radius) {
    }

    /**
     * Groups circles whose centres lie within the largest detected radius of the first circle of a
     * row. Rows are returned top to bottom, each sorted left to right.
     */
    static List<List<Circle>> rows(List<Circle> circles) {
        if (circles.isEmpty()) {
            return List.of();
        }
        double tolerance = circles.stream().mapToDouble(Circle::radius).max().orElse(0);
        List<Circle> byY = new ArrayList<>(circles);
        byY.sort(Comparator.comparingDouble(Circle::y));

        List<List<Circle>> rows = new ArrayList<>();
        List<Circle> current = new ArrayList<>();
        double anchorY = byY.get(0).y();
        for (Circle circle : byY) {
            if (circle.y() - anchorY > tolerance) {
                rows.add(sortedByX(current));
                current = new ArrayList<>();
                anchorY = circle.y();
            }
            current.add(circle);
        }
        rows.add(sortedByX(current));
        return rows;
    }

    private static List<Circle> sortedByX(List<Circle> row) {
        row.sort(Comparator.comparingDouble(Circle::x));
        return List.copyOf(row);
    }

    /**
     * Picks the marked choice of one row from the mean gray level of each bubble. A row counts as
     * answered when the contrast between its bubbles exceeds {@code relativeThreshold} or its
     * darkest bubble is below {@code absoluteThreshold}. Every bubble within {@code tieMargin} of
     * the darkest one is considered filled; more than one filled bubble voids the answer.
     */
    static String markedChoice(double[] meanIntensities, double relativeThreshold, double absoluteThreshold,
            double tieMargin) {
        if (meanIntensities.length == 0) {
            return NO_ANSWER;
        }
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        int darkest = -1;
        for (int i = 0; i < meanIntensities.length; i++) {
            double value = meanIntensities[i];
            if (value < min) {
                min = value;
                darkest = i;
            }
            max = Math.max(max, value);
        }
        boolean marked = (max - min) > relativeThreshold || min < absoluteThreshold;
        if (!marked) {
            return NO_ANSWER;
        }
        int filled = 0;
        for (double value : meanIntensities) {
            if (value <= min + tieMargin) {
                filled++;
            }
        }
        return filled == 1 ? choiceLetter(darkest) : NO_ANSWER;
    }

    static String choiceLetter(int index) {
        return String.valueOf((char) ('A' + index));
    }
}

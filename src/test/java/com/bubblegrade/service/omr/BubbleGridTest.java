package com.bubblegrade.service.omr;

import static org.assertj.core.api.Assertions.assertThat;

import com.bubblegrade.service.omr.BubbleGrid.Circle;
import java.util.List;
import org.junit.jupiter.api.Test;

class BubbleGridTest {

    @Test
    void groupsCirclesIntoRowsOrderedLeftToRight() {
        List<Circle> circles = List.of(
                new Circle(120, 52, 12),
                new Circle(40, 48, 12),
                new Circle(80, 50, 12),
                new Circle(80, 101, 12),
                new Circle(40, 99, 12));

        List<List<Circle>> rows = BubbleGrid.rows(circles);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).extracting(Circle::x).containsExactly(40.0, 80.0, 120.0);
        assertThat(rows.get(1)).extracting(Circle::x).containsExactly(40.0, 80.0);
    }

    @Test
    void returnsNoRowsWithoutCircles() {
        assertThat(BubbleGrid.rows(List.of())).isEmpty();
    }

    @Test
    void picksDarkestBubbleWhenContrastIsStrong() {
        String choice = BubbleGrid.markedChoice(new double[] {230, 60, 228, 231}, 25, 180, 15);

        assertThat(choice).isEqualTo("B");
    }

    @Test
    void leavesRowUnansweredWhenAllBubblesAreBlank() {
        String choice = BubbleGrid.markedChoice(new double[] {235, 228, 240, 232}, 25, 180, 15);

        assertThat(choice).isEqualTo(BubbleGrid.NO_ANSWER);
    }

    @Test
    void voidsRowWithTwoFilledBubbles() {
        String choice = BubbleGrid.markedChoice(new double[] {70, 230, 78, 229}, 25, 180, 15);

        assertThat(choice).isEqualTo(BubbleGrid.NO_ANSWER);
    }

    @Test
    void acceptsUniformlyDarkSingleBubbleByAbsoluteThreshold() {
        String choice = BubbleGrid.markedChoice(new double[] {90}, 25, 180, 15);

        assertThat(choice).isEqualTo("A");
    }
}

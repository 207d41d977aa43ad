package com.tony.betCalibration.service.calibration;

import com.tony.betCalibration.exception.ShapeMismatchException;
import com.tony.betCalibration.model.IsotonicCalibrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Régression isotonique par Pool-Adjacent-Violators.
 */
@Component
@Slf4j
public class IsotonicFitter {

    public IsotonicCalibrator fit(double[] p, double[] y) {
        ShapeMismatchException.check(p, y);
        if (p.length == 0) {
            return IsotonicCalibrator.empty();
        }

        // Tri stable par probabilité : les ex aequo gardent l'ordre d'origine
        int[] order = IntStream.range(0, p.length)
                .boxed()
                .sorted(Comparator.comparingDouble(i -> p[i]))
                .mapToInt(Integer::intValue)
                .toArray();

        List<Block> blocks = new ArrayList<>(p.length);
        for (int idx : order) {
            blocks.add(new Block(p[idx], y[idx]));
        }

        int i = 0;
        while (i < blocks.size() - 1) {
            Block left = blocks.get(i);
            Block right = blocks.get(i + 1);
            if (left.meanY() <= right.meanY()) {
                i++;
                continue;
            }
            left.absorb(right);
            blocks.remove(i + 1);
            // On revérifie avec le bloc précédent, jamais avant le premier
            i = Math.max(i - 1, 0);
        }

        double[] xs = new double[blocks.size()];
        double[] ys = new double[blocks.size()];
        for (int k = 0; k < blocks.size(); k++) {
            xs[k] = blocks.get(k).meanX();
            ys[k] = blocks.get(k).meanY();
        }
        log.debug("PAV : {} points -> {} noeuds", p.length, xs.length);
        return new IsotonicCalibrator(xs, ys);
    }

    private static final class Block {
        private double sumX;
        private double sumY;
        private int count;

        Block(double x, double y) {
            this.sumX = x;
            this.sumY = y;
            this.count = 1;
        }

        void absorb(Block other) {
            sumX += other.sumX;
            sumY += other.sumY;
            count += other.count;
        }

        double meanX() {
            return sumX / count;
        }

        double meanY() {
            return sumY / count;
        }
    }
}

package home.purpleair.model;

import java.util.List;

/**
 * Опорные точки кусочно-линейной шкалы AQI для одного загрязнителя.
 * Первая точка всегда (0, 0), обе колонки строго возрастают.
 */
public class BreakpointTable {
    private final List<Breakpoint> breakpoints;

    public BreakpointTable(List<Breakpoint> breakpoints) {
        if (breakpoints.isEmpty()) {
            throw new IllegalArgumentException("Таблица AQI не может быть пустой");
        }
        Breakpoint first = breakpoints.get(0);
        if (first.getConcentration() != 0 || first.getAqi() != 0) {
            throw new IllegalArgumentException("Таблица AQI должна начинаться с точки (0, 0)");
        }
        for (int i = 1; i < breakpoints.size(); i++) {
            Breakpoint previous = breakpoints.get(i - 1);
            Breakpoint current = breakpoints.get(i);
            if (current.getConcentration() <= previous.getConcentration() || current.getAqi() <= previous.getAqi()) {
                throw new IllegalArgumentException("Точки таблицы AQI должны строго возрастать, нарушение на позиции " + i);
            }
        }
        this.breakpoints = List.copyOf(breakpoints);
    }

    /**
     * Собирает таблицу из пар значений концентрация, AQI
     */
    public static BreakpointTable of(double... pairs) {
        if (pairs.length % 2 != 0) {
            throw new IllegalArgumentException("Ожидаются пары концентрация, AQI");
        }
        Breakpoint[] points = new Breakpoint[pairs.length / 2];
        for (int i = 0; i < points.length; i++) {
            points[i] = new Breakpoint(pairs[2 * i], pairs[2 * i + 1]);
        }
        return new BreakpointTable(List.of(points));
    }

    public List<Breakpoint> getBreakpoints() {
        return breakpoints;
    }

    public static class Breakpoint {
        private final double concentration;
        private final double aqi;

        public Breakpoint(double concentration, double aqi) {
            this.concentration = concentration;
            this.aqi = aqi;
        }

        public double getConcentration() {
            return concentration;
        }

        public double getAqi() {
            return aqi;
        }
    }
}

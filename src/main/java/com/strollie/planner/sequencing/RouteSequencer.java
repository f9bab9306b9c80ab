package com.strollie.planner.sequencing;

import com.strollie.planner.config.PlannerProperties;
import com.strollie.planner.geo.GeoMath;
import com.strollie.planner.model.GeoPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Orders stops to shorten the open walk that begins at the start point.
 * <p>
 * Up to {@value #EXACT_LIMIT} stops the order is exact (Held-Karp over subsets). Beyond that a nearest-neighbour
 * tour is improved by first-improvement 2-opt. Distances are straight-line; the time budget is applied later.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteSequencer {

    public static final int EXACT_LIMIT = 7;
    private static final double EPSILON = 1e-9;

    private final PlannerProperties properties;

    public <T> List<T> sequence(List<T> items, Function<T, GeoPoint> locationOf, GeoPoint start) {
        if (items.size() <= 1) {
            return new ArrayList<>(items);
        }
        List<GeoPoint> points = new ArrayList<>(items.size() + 1);
        points.add(start);
        items.forEach(item -> points.add(locationOf.apply(item)));
        double[][] dist = GeoMath.distanceMatrix(points);

        int[] order;
        int n = items.size();
        if (n <= EXACT_LIMIT) {
            order = exactOrder(dist, n);
        } else {
            int maxIterations = properties.getSequencerMaxIterations();
            int passes = n <= 15 ? Math.max(10, maxIterations) : Math.max(5, maxIterations / 2);
            int[] seed = nearestNeighborOrder(dist, n);
            order = twoOpt(seed, dist, passes);
            log.debug("2-opt: {} stops, {} km -> {} km", n, routeLength(seed, dist), routeLength(order, dist));
        }

        List<T> ordered = new ArrayList<>(n);
        for (int idx : order) {
            ordered.add(items.get(idx));
        }
        return ordered;
    }

    /**
     * Length of the open path start -> order[0] -> ... in the same units as {@code dist}.
     * Indices in {@code order} are zero-based stop indices; row/column 0 of {@code dist} is the start.
     */
    static double routeLength(int[] order, double[][] dist) {
        double total = 0;
        int current = 0;
        for (int idx : order) {
            total += dist[current][idx + 1];
            current = idx + 1;
        }
        return total;
    }

    public static double routeLengthKm(GeoPoint start, List<GeoPoint> stops) {
        double total = 0;
        GeoPoint current = start;
        for (GeoPoint stop : stops) {
            total += GeoMath.haversineKm(current, stop);
            current = stop;
        }
        return total;
    }

    static int[] exactOrder(double[][] dist, int n) {
        int size = 1 << n;
        double[][] dp = new double[size][n];
        int[][] parent = new int[size][n];
        for (double[] row : dp) {
            Arrays.fill(row, Double.POSITIVE_INFINITY);
        }
        for (int[] row : parent) {
            Arrays.fill(row, -1);
        }
        for (int i = 0; i < n; i++) {
            dp[1 << i][i] = dist[0][i + 1];
        }

        for (int mask = 1; mask < size; mask++) {
            for (int last = 0; last < n; last++) {
                if ((mask & (1 << last)) == 0 || dp[mask][last] == Double.POSITIVE_INFINITY) {
                    continue;
                }
                double cost = dp[mask][last];
                for (int next = 0; next < n; next++) {
                    if ((mask & (1 << next)) != 0) {
                        continue;
                    }
                    int nextMask = mask | (1 << next);
                    double candidate = cost + dist[last + 1][next + 1];
                    if (candidate < dp[nextMask][next]) {
                        dp[nextMask][next] = candidate;
                        parent[nextMask][next] = last;
                    }
                }
            }
        }

        int mask = size - 1;
        int last = 0;
        for (int i = 1; i < n; i++) {
            if (dp[mask][i] < dp[mask][last]) {
                last = i;
            }
        }
        List<Integer> reversed = new ArrayList<>(n);
        while (last != -1) {
            reversed.add(last);
            int prev = parent[mask][last];
            mask &= ~(1 << last);
            last = prev;
        }
        Collections.reverse(reversed);
        return reversed.stream().mapToInt(Integer::intValue).toArray();
    }

    static int[] nearestNeighborOrder(double[][] dist, int n) {
        boolean[] visited = new boolean[n];
        int[] order = new int[n];
        int current = 0;
        for (int step = 0; step < n; step++) {
            int nearest = -1;
            for (int i = 0; i < n; i++) {
                if (!visited[i] && (nearest == -1 || dist[current][i + 1] < dist[current][nearest + 1])) {
                    nearest = i;
                }
            }
            visited[nearest] = true;
            order[step] = nearest;
            current = nearest + 1;
        }
        return order;
    }

    /**
     * Reverses {@code order[i..j]} whenever that strictly shortens the path, restarting after each improvement.
     * The start is fixed outside the array, so the first stop may move too.
     */
    static int[] twoOpt(int[] seed, double[][] dist, int maxPasses) {
        int[] best = seed.clone();
        if (best.length < 3 || maxPasses <= 0) {
            return best;
        }
        double bestLength = routeLength(best, dist);
        boolean improved = true;
        int pass = 0;
        while (improved && pass < maxPasses) {
            improved = false;
            pass++;
            search:
            for (int i = 0; i < best.length - 1; i++) {
                for (int j = i + 1; j < best.length; j++) {
                    int[] candidate = best.clone();
                    reverse(candidate, i, j);
                    double length = routeLength(candidate, dist);
                    if (length + EPSILON < bestLength) {
                        best = candidate;
                        bestLength = length;
                        improved = true;
                        break search;
                    }
                }
            }
        }
        return best;
    }

    private static void reverse(int[] order, int from, int to) {
        while (from < to) {
            int tmp = order[from];
            order[from] = order[to];
            order[to] = tmp;
            from++;
            to--;
        }
    }
}

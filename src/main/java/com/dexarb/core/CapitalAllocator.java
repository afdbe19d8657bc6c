package com.dexarb.core;

import com.dexarb.config.ArbProperties;
import com.dexarb.domain.AllocationResult;
import com.dexarb.domain.ArbitragePath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.function.ToDoubleFunction;

/**
 * Splits a capital budget across candidate paths.
 * <p>
 * Search order: equal split (the baseline), randomized trials, then hill climbing on the best
 * vector found. The best vector only ever gets replaced by a strictly better one, so the result
 * never scores below the baseline.
 */
@Slf4j
@Service
public class CapitalAllocator {

    private static final double SCALE_GUARD = 1.0 - 1e-12;

    private final ProfitModel profitModel;
    private final Random random;
    private final int trials;
    private final double minAllocationFraction;
    private final double stepFraction;
    private final int maxHillClimbIterations;

    @Autowired
    public CapitalAllocator(ArbProperties properties, ProfitModel profitModel) {
        this(properties, profitModel, properties.getAllocation().getRandomSeed() != null
                ? new Random(properties.getAllocation().getRandomSeed())
                : new Random());
    }

    public CapitalAllocator(ArbProperties properties, ProfitModel profitModel, Random random) {
        this.profitModel = profitModel;
        this.random = random;
        this.trials = properties.getMonteCarloTrials();
        this.minAllocationFraction = properties.getAllocation().getMinAllocationFraction();
        this.stepFraction = properties.getAllocation().getHillClimbStepFraction();
        this.maxHillClimbIterations = properties.getAllocation().getMaxHillClimbIterations();
    }

    public AllocationResult optimize(List<ArbitragePath> paths, double totalCapital) {
        return optimize(paths, totalCapital, path -> 0.0);
    }

    /**
     * @param executionCost cost charged against a path whenever it receives capital, in profit
     *                      token units (typically the gas to execute it)
     */
    public AllocationResult optimize(List<ArbitragePath> paths, double totalCapital,
                                     ToDoubleFunction<ArbitragePath> executionCost) {
        if (paths.isEmpty() || totalCapital <= 0 || Double.isNaN(totalCapital)) {
            return AllocationResult.empty(0.0);
        }
        int n = paths.size();
        double[] costs = new double[n];
        for (int i = 0; i < n; i++) {
            costs[i] = Math.max(0.0, executionCost.applyAsDouble(paths.get(i)));
        }
        double minAllocation = minAllocationFraction * totalCapital;

        double[] baseline = new double[n];
        Arrays.fill(baseline, totalCapital / n);
        fitToBudget(baseline, totalCapital);
        zeroDust(baseline, minAllocation);
        double baselineProfit = score(paths, baseline, costs);

        double[] best = baseline.clone();
        double bestProfit = baselineProfit;

        // each path's own optimum, scaled into the budget
        double[] sized = new double[n];
        for (int i = 0; i < n; i++) {
            sized[i] = Math.max(0.0, paths.get(i).getRequiredInput());
        }
        fitToBudget(sized, totalCapital);
        zeroDust(sized, minAllocation);
        double sizedProfit = score(paths, sized, costs);
        if (sizedProfit > bestProfit) {
            best = sized;
            bestProfit = sizedProfit;
        }

        for (int t = 0; t < trials; t++) {
            double[] candidate = (t % 2 == 0 || bestProfit <= 0)
                    ? randomSimplexPoint(n, totalCapital)
                    : perturb(best, totalCapital);
            zeroDust(candidate, minAllocation);
            double profit = score(paths, candidate, costs);
            if (profit > bestProfit) {
                best = candidate;
                bestProfit = profit;
            }
        }

        double[] climbed = hillClimb(paths, costs, best, bestProfit, totalCapital, minAllocation);
        double climbedProfit = score(paths, climbed, costs);
        if (climbedProfit > bestProfit) {
            best = climbed;
            bestProfit = climbedProfit;
        }

        if (bestProfit <= 0) {
            log.debug("No positive allocation across {} paths (baseline {})", n, baselineProfit);
            return AllocationResult.empty(baselineProfit);
        }

        List<Double> allocations = new ArrayList<>(n);
        for (double a : best) {
            allocations.add(a);
        }
        return new AllocationResult(List.copyOf(allocations), bestProfit, baselineProfit);
    }

    double score(List<ArbitragePath> paths, double[] allocation) {
        return score(paths, allocation, new double[allocation.length]);
    }

    private double score(List<ArbitragePath> paths, double[] allocation, double[] costs) {
        double total = 0.0;
        for (int i = 0; i < allocation.length; i++) {
            if (allocation[i] > 0) {
                total += profitModel.profit(paths.get(i), allocation[i]) - costs[i];
            }
        }
        return total;
    }

    /**
     * Moves capital between paths, and between paths and the unallocated reserve, while that
     * improves profit. The step halves whenever no move helps.
     */
    private double[] hillClimb(List<ArbitragePath> paths, double[] costs, double[] start, double startProfit,
                               double totalCapital, double minAllocation) {
        int n = start.length;
        double[] current = start.clone();
        double currentProfit = startProfit;
        double step = Math.max(stepFraction * totalCapital, Double.MIN_NORMAL);
        double minStep = totalCapital * 1e-6;

        for (int iteration = 0; iteration < maxHillClimbIterations && step >= minStep; iteration++) {
            double[] bestMove = null;
            double bestMoveProfit = currentProfit;

            // index n is the reserve
            for (int from = 0; from <= n; from++) {
                for (int to = 0; to <= n; to++) {
                    if (from == to) {
                        continue;
                    }
                    double[] moved = transfer(current, from, to, step, totalCapital, minAllocation);
                    if (moved == null) {
                        continue;
                    }
                    double profit = score(paths, moved, costs);
                    if (profit > bestMoveProfit) {
                        bestMove = moved;
                        bestMoveProfit = profit;
                    }
                }
            }

            if (bestMove == null) {
                step /= 2;
            } else {
                current = bestMove;
                currentProfit = bestMoveProfit;
            }
        }
        return current;
    }

    private double[] transfer(double[] current, int from, int to, double step,
                              double totalCapital, double minAllocation) {
        int n = current.length;
        double available = from == n ? totalCapital - sum(current) : current[from];
        // a path coming back from zero has to clear the dust threshold to count
        double amount = (to < n && current[to] == 0) ? Math.max(step, minAllocation) : step;
        amount = Math.min(amount, available);
        if (amount <= 0) {
            return null;
        }
        double[] moved = current.clone();
        if (from < n) {
            moved[from] -= amount;
        }
        if (to < n) {
            moved[to] += amount;
        }
        fitToBudget(moved, totalCapital);
        zeroDust(moved, minAllocation);
        return moved;
    }

    private double[] randomSimplexPoint(int n, double totalCapital) {
        // n + 1 exponential draws: the extra one is the share left unallocated
        double[] draws = new double[n + 1];
        double total = 0.0;
        for (int i = 0; i <= n; i++) {
            draws[i] = -Math.log(1.0 - random.nextDouble());
            total += draws[i];
        }
        double[] point = new double[n];
        for (int i = 0; i < n; i++) {
            point[i] = totalCapital * draws[i] / total;
        }
        fitToBudget(point, totalCapital);
        return point;
    }

    private double[] perturb(double[] base, double totalCapital) {
        double sigma = 0.1 * totalCapital;
        double[] point = new double[base.length];
        for (int i = 0; i < base.length; i++) {
            point[i] = Math.max(0.0, base[i] + random.nextGaussian() * sigma);
        }
        fitToBudget(point, totalCapital);
        return point;
    }

    private static void fitToBudget(double[] allocation, double totalCapital) {
        double total = sum(allocation);
        if (total > totalCapital) {
            double factor = totalCapital / total * SCALE_GUARD;
            for (int i = 0; i < allocation.length; i++) {
                allocation[i] *= factor;
            }
        }
    }

    private static void zeroDust(double[] allocation, double minAllocation) {
        for (int i = 0; i < allocation.length; i++) {
            if (allocation[i] < minAllocation) {
                allocation[i] = 0.0;
            }
        }
    }

    private static double sum(double[] values) {
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total;
    }
}

package com.quantsim.simulator.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Calculator for simulation performance metrics.
 * Returns, drawdown and ratios are fractions (0.25 means 25%), rounded to 6 decimals.
 * Every method accepts empty input and answers zero.
 */
@Slf4j
public class PerformanceMetrics {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    private static final int SCALE = 6;

    private PerformanceMetrics() {
    }

    /**
     * Compute the full report for one equity curve and its trade log.
     */
    public static PerformanceReport analyze(List<EquitySnapshot> equityCurve, List<TradeRecord> trades,
                                            BigDecimal initialCapital, double riskFreeRate) {
        List<BigDecimal> values = new ArrayList<>();
        for (EquitySnapshot snapshot : equityCurve) {
            values.add(snapshot.getTotalEquity());
        }
        BigDecimal finalValue = values.isEmpty() ? initialCapital : values.get(values.size() - 1);
        long durationDays = equityCurve.size() < 2 ? 0
                : ChronoUnit.DAYS.between(equityCurve.get(0).getDate(), equityCurve.get(equityCurve.size() - 1).getDate());

        BigDecimal totalCost = BigDecimal.ZERO;
        BigDecimal totalSlippage = BigDecimal.ZERO;
        for (TradeRecord trade : trades) {
            totalCost = totalCost.add(trade.getCost());
            totalSlippage = totalSlippage.add(trade.getSlippageCost());
        }

        PerformanceReport report = PerformanceReport.builder()
                .initialCapital(initialCapital)
                .finalValue(finalValue)
                .totalReturn(calculateTotalReturn(initialCapital, finalValue))
                .cagr(calculateCAGR(initialCapital, finalValue, durationDays))
                .maxDrawdown(calculateMaxDrawdown(values))
                .sharpeRatio(calculateSharpeRatio(values, riskFreeRate))
                .sortinoRatio(calculateSortinoRatio(values, riskFreeRate))
                .volatility(calculateVolatility(values))
                .winRate(calculateWinRate(trades))
                .totalTrades(trades.size())
                .totalCost(totalCost)
                .totalSlippage(totalSlippage.setScale(2, RoundingMode.HALF_UP))
                .tradingDays(equityCurve.size())
                .build();

        log.debug("Performance: return={}, cagr={}, maxDD={}, sharpe={}", report.getTotalReturn(),
                report.getCagr(), report.getMaxDrawdown(), report.getSharpeRatio());
        return report;
    }

    /**
     * Calculate total return as {@code final / initial - 1}.
     */
    public static BigDecimal calculateTotalReturn(BigDecimal initialCapital, BigDecimal finalValue) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return finalValue.subtract(initialCapital).divide(initialCapital, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Calculate compound annual growth rate: {@code (final / initial)^(365 / days) - 1}.
     * Zero when the curve spans no time.
     */
    public static BigDecimal calculateCAGR(BigDecimal initialCapital, BigDecimal finalValue, long durationDays) {
        if (durationDays <= 0 || initialCapital == null || initialCapital.signum() <= 0 || finalValue.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        double growth = finalValue.divide(initialCapital, MathContext.DECIMAL64).doubleValue();
        double cagr = Math.pow(growth, 365.0 / durationDays) - 1.0;
        return toDecimal(cagr);
    }

    /**
     * Calculate maximum drawdown: the most negative {@code (equity - runningMax) / runningMax}.
     */
    public static BigDecimal calculateMaxDrawdown(List<BigDecimal> portfolioValues) {
        if (portfolioValues.isEmpty()) {
            return BigDecimal.ZERO.setScale(SCALE);
        }

        BigDecimal maxDrawdown = BigDecimal.ZERO.setScale(SCALE);
        BigDecimal peak = portfolioValues.get(0);

        for (BigDecimal value : portfolioValues) {
            if (value.compareTo(peak) > 0) {
                peak = value;
            }
            if (peak.signum() > 0) {
                BigDecimal drawdown = value.subtract(peak).divide(peak, SCALE, RoundingMode.HALF_UP);
                if (drawdown.compareTo(maxDrawdown) < 0) {
                    maxDrawdown = drawdown;
                }
            }
        }
        return maxDrawdown;
    }

    /**
     * Calculate annualized Sharpe ratio:
     * {@code mean(r - rf/252) / std(r) * sqrt(252)}, zero when returns have no variance.
     */
    public static BigDecimal calculateSharpeRatio(List<BigDecimal> portfolioValues, double riskFreeRate) {
        double[] returns = dailyReturns(portfolioValues);
        if (returns.length == 0) {
            return BigDecimal.ZERO;
        }
        double stdDev = stdDev(returns);
        if (stdDev == 0) {
            return BigDecimal.ZERO;
        }
        double dailyRf = riskFreeRate / TRADING_DAYS_PER_YEAR;
        double excess = mean(returns) - dailyRf;
        return toDecimal(excess / stdDev * Math.sqrt(TRADING_DAYS_PER_YEAR));
    }

    /**
     * Calculate annualized Sortino ratio, using only negative returns for the deviation.
     */
    public static BigDecimal calculateSortinoRatio(List<BigDecimal> portfolioValues, double riskFreeRate) {
        double[] returns = dailyReturns(portfolioValues);
        if (returns.length == 0) {
            return BigDecimal.ZERO;
        }
        double sumSquaredDownside = 0;
        for (double r : returns) {
            if (r < 0) {
                sumSquaredDownside += r * r;
            }
        }
        double downsideDev = Math.sqrt(sumSquaredDownside / returns.length);
        if (downsideDev == 0) {
            return BigDecimal.ZERO;
        }
        double excess = mean(returns) - riskFreeRate / TRADING_DAYS_PER_YEAR;
        return toDecimal(excess / downsideDev * Math.sqrt(TRADING_DAYS_PER_YEAR));
    }

    /**
     * Calculate annualized volatility of daily returns.
     */
    public static BigDecimal calculateVolatility(List<BigDecimal> portfolioValues) {
        double[] returns = dailyReturns(portfolioValues);
        if (returns.length == 0) {
            return BigDecimal.ZERO;
        }
        return toDecimal(stdDev(returns) * Math.sqrt(TRADING_DAYS_PER_YEAR));
    }

    /**
     * Calculate the share of sells that closed units above their average cost, costs included.
     */
    public static BigDecimal calculateWinRate(List<TradeRecord> trades) {
        Map<String, long[]> units = new HashMap<>();
        Map<String, BigDecimal> costBasis = new HashMap<>();
        int closed = 0;
        int winning = 0;

        for (TradeRecord trade : trades) {
            String asset = trade.getAsset();
            long held = units.computeIfAbsent(asset, a -> new long[1])[0];
            BigDecimal basis = costBasis.getOrDefault(asset, BigDecimal.ZERO);

            if (trade.getAction() == TradeAction.BUY) {
                units.get(asset)[0] = held + trade.getQuantity();
                costBasis.put(asset, basis.add(trade.getNetCashDelta().negate()));
            } else if (held > 0) {
                long sold = Math.min(held, trade.getQuantity());
                BigDecimal soldBasis = basis.multiply(BigDecimal.valueOf(sold))
                        .divide(BigDecimal.valueOf(held), 10, RoundingMode.HALF_UP);
                closed++;
                if (trade.getNetCashDelta().compareTo(soldBasis) > 0) {
                    winning++;
                }
                units.get(asset)[0] = held - sold;
                costBasis.put(asset, basis.subtract(soldBasis));
            }
        }

        if (closed == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(winning).divide(BigDecimal.valueOf(closed), 4, RoundingMode.HALF_UP);
    }

    private static double[] dailyReturns(List<BigDecimal> portfolioValues) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < portfolioValues.size(); i++) {
            BigDecimal prev = portfolioValues.get(i - 1);
            if (prev.signum() > 0) {
                returns.add(portfolioValues.get(i).subtract(prev)
                        .divide(prev, MathContext.DECIMAL64).doubleValue());
            }
        }
        return returns.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double stdDev(double[] values) {
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            sumSquaredDiff += (v - mean) * (v - mean);
        }
        double stdDev = Math.sqrt(sumSquaredDiff / values.length);
        // float noise on a constant series
        return stdDev < 1e-12 ? 0 : stdDev;
    }

    private static BigDecimal toDecimal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP);
    }
}

package tgp.scheduler.cost;

import tgp.scheduler.exception.InvalidCostInputException;
import tgp.scheduler.model.CostBreakdown;

/**
 * Total-cost-of-ownership formula:
 *
 * <pre>
 * C_comp  = pricePerHour * durationHours * utilizationFactor
 * C_data  = dataSizeGb * transferPricePerGb
 * C_idle  = idleCapacityHours * opportunityCostPerHour
 * C_total = C_comp + C_data + C_idle
 * </pre>
 *
 * Stateless; safe to share between threads.
 */
public final class CostEngine {

    /**
     * Evaluate the formula.
     *
     * @throws InvalidCostInputException if any input is negative, NaN or infinite
     */
    public CostBreakdown evaluate(double pricePerHour,
            double durationHours,
            double utilizationFactor,
            double dataSizeGb,
            double transferPricePerGb,
            double idleCapacityHours,
            double opportunityCostPerHour) {
        check("pricePerHour", pricePerHour);
        check("durationHours", durationHours);
        check("utilizationFactor", utilizationFactor);
        check("dataSizeGb", dataSizeGb);
        check("transferPricePerGb", transferPricePerGb);
        check("idleCapacityHours", idleCapacityHours);
        check("opportunityCostPerHour", opportunityCostPerHour);

        double compute = computeCost(pricePerHour, durationHours, utilizationFactor);
        double data = dataTransferCost(dataSizeGb, transferPricePerGb);
        double idle = idleOpportunityCost(idleCapacityHours, opportunityCostPerHour);
        return CostBreakdown.of(compute, data, idle);
    }

    double computeCost(double pricePerHour, double durationHours, double utilizationFactor) {
        return pricePerHour * durationHours * utilizationFactor;
    }

    double dataTransferCost(double dataSizeGb, double transferPricePerGb) {
        return dataSizeGb * transferPricePerGb;
    }

    double idleOpportunityCost(double idleCapacityHours, double opportunityCostPerHour) {
        return idleCapacityHours * opportunityCostPerHour;
    }

    private static void check(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new InvalidCostInputException(name, value);
        }
    }
}

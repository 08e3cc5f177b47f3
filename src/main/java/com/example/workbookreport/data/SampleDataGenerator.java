package com.example.workbookreport.data;

import com.example.workbookreport.model.Dataset;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synthetic sales and financial data for demonstrating the report. Output depends only on the seed
 * and the clock's current date.
 */
public class SampleDataGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SampleDataGenerator.class);

    public static final List<String> SALES_COLUMNS = List.of(
            "date", "product", "region", "seller", "quantity", "unit_price", "discount", "category",
            "gross_value", "discount_value", "net_value");
    public static final List<String> FINANCIAL_COLUMNS = List.of(
            "month", "revenue", "costs", "operating_expenses", "taxes", "investments", "employees",
            "gross_profit", "net_profit", "net_margin");

    private static final List<String> PRODUCTS = List.of("Product A", "Product B", "Product C", "Product D", "Product E");
    private static final List<String> REGIONS = List.of("North", "South", "East", "West", "Central");
    private static final List<String> SELLERS = List.of("John Smith", "Mary Santos", "Peter Costa", "Anna Oliver", "Carl Lima");
    private static final List<String> CATEGORIES = List.of("Electronics", "Clothing", "Home", "Sports");
    private static final double MEAN_DAILY_ORDERS = 15.0;
    private static final double WEEKEND_FACTOR = 0.7;

    private final long seed;
    private final Clock clock;

    public SampleDataGenerator(long seed, Clock clock) {
        this.seed = seed;
        this.clock = clock;
    }

    /**
     * One row per order over the last {@code days} days, today included.
     */
    public Dataset generateSales(int days) {
        Random random = new Random(seed);
        LocalDate end = LocalDate.now(clock);
        Dataset.Builder builder = Dataset.builder(SALES_COLUMNS);

        for (LocalDate date = end.minusDays(days); !date.isAfter(end); date = date.plusDays(1)) {
            int orders = poisson(random, MEAN_DAILY_ORDERS);
            if (isWeekend(date)) {
                orders = (int) Math.round(orders * WEEKEND_FACTOR);
            }
            for (int i = 0; i < orders; i++) {
                int quantity = 1 + random.nextInt(9);
                double unitPrice = uniform(random, 50, 500);
                double discount = uniform(random, 0, 0.15);
                double gross = quantity * unitPrice;
                double discountValue = gross * discount;
                builder.addRow(date, pick(random, PRODUCTS), pick(random, REGIONS), pick(random, SELLERS),
                        quantity, unitPrice, discount, pick(random, CATEGORIES),
                        gross, discountValue, gross - discountValue);
            }
        }

        Dataset sales = builder.build();
        LOGGER.info("Generated {} sales records over {} days", sales.getRowCount(), days);
        return sales;
    }

    /**
     * One row per month for the last {@code months} months, the current month last.
     */
    public Dataset generateFinancials(int months) {
        Random random = new Random(seed);
        YearMonth current = YearMonth.now(clock);
        Dataset.Builder builder = Dataset.builder(FINANCIAL_COLUMNS);

        for (int offset = months - 1; offset >= 0; offset--) {
            double revenue = uniform(random, 100_000, 200_000);
            double costs = uniform(random, 60_000, 120_000);
            double operatingExpenses = uniform(random, 20_000, 40_000);
            double taxes = uniform(random, 8_000, 15_000);
            double investments = uniform(random, 5_000, 25_000);
            int employees = 45 + random.nextInt(20);
            double grossProfit = revenue - costs;
            double netProfit = grossProfit - operatingExpenses - taxes;
            builder.addRow(current.minusMonths(offset).toString(), revenue, costs, operatingExpenses, taxes,
                    investments, employees, grossProfit, netProfit, netProfit / revenue * 100);
        }

        Dataset financials = builder.build();
        LOGGER.info("Generated {} monthly financial records", financials.getRowCount());
        return financials;
    }

    private static boolean isWeekend(LocalDate date) {
        return date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY;
    }

    private static double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    private static String pick(Random random, List<String> values) {
        return values.get(random.nextInt(values.size()));
    }

    // Knuth's multiplication method, fine for small means
    private static int poisson(Random random, double mean) {
        double limit = Math.exp(-mean);
        double product = random.nextDouble();
        int count = 0;
        while (product > limit) {
            count++;
            product *= random.nextDouble();
        }
        return count;
    }
}

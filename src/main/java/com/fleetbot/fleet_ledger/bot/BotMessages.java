package com.fleetbot.fleet_ledger.bot;

import com.fleetbot.fleet_ledger.config.FleetLedgerProperties;
import com.fleetbot.fleet_ledger.dto.FleetStats;
import com.fleetbot.fleet_ledger.dto.TopPerformer;
import com.fleetbot.fleet_ledger.dto.TrendPoint;
import com.fleetbot.fleet_ledger.dto.WeekWindow;
import com.fleetbot.fleet_ledger.exception.NotFoundException;
import com.fleetbot.fleet_ledger.exception.StorageException;
import com.fleetbot.fleet_ledger.exception.ValidationException;
import com.fleetbot.fleet_ledger.model.Vehicle;
import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Chat texts (Telegram HTML) for the bot's replies.
 */
@Component
@RequiredArgsConstructor
public class BotMessages {

    static final String HELP = "Welcome! I am your Fleet Ledger Bot. Commands:\n\n" +
            "<b>Fleet:</b>\n" +
            "  <code>/list_vehicles</code>\n\n" +
            "<b>Weekly Data:</b>\n" +
            "  <code>/submit_week</code> - Enter a vehicle's weekly figures\n" +
            "  <code>/entries</code> (e.g. /entries 2025-10-20)\n" +
            "  <code>/delete_entry</code> (e.g. /delete_entry 42)\n\n" +
            "<b>Dashboard:</b>\n" +
            "  <code>/fleet_stats</code> (e.g. /fleet_stats 2025-10-20)\n" +
            "  <code>/trend</code> (e.g. /trend 8 ABC123)\n\n" +
            "<b>Reports:</b>\n" +
            "  <code>/weekly_report</code> (e.g. /weekly_report 2025-10-20 2025-10-26)\n" +
            "  <code>/vehicle_report</code> (e.g. /vehicle_report ABC123 2025-09-01 2025-10-31)\n\n" +
            "<b>Other:</b>\n" +
            "  <code>/cancel</code> - Cancel current operation";

    private final FleetLedgerProperties properties;

    public String vehicles(List<Vehicle> vehicles) {
        if (vehicles.isEmpty()) {
            return "No vehicles registered yet.";
        }
        StringBuilder sb = new StringBuilder("<b>Fleet Vehicles:</b>\n");
        for (Vehicle v : vehicles) {
            sb.append(String.format("- <b>%s</b> %s (%s) [%s]\n", html(v.getVehicleNumber()), html(v.getDriverName()),
                    html(v.getPhoneNumber()), v.getStatus().name().toLowerCase(Locale.ROOT)));
        }
        return sb.toString();
    }

    public String entrySaved(WeeklyLedgerEntry entry) {
        return String.format("✅ Week of <b>%s</b> saved for <b>%s</b>.\n" +
                        "- Total Revenue: %s\n" +
                        "- Total Deductions: %s\n" +
                        "- <b>Net Profit: %s</b>\n" +
                        "- Profit Margin: %s",
                entry.getWeekStartDate(), html(entry.getVehicle().getVehicleNumber()),
                money(entry.getTotalRevenue()), money(entry.getTotalDeductions()),
                money(entry.getNetProfit()), percent(entry.getProfitMargin()));
    }

    public String entries(WeekWindow window, List<WeeklyLedgerEntry> entries) {
        if (entries.isEmpty()) {
            return "No weekly data found for " + window.getStart() + " to " + window.getEnd() + ".";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("<b>Weekly Data ").append(window.getStart()).append(" to ").append(window.getEnd()).append(":</b>\n");
        for (WeeklyLedgerEntry e : entries) {
            sb.append(String.format("- #%d <b>%s</b> week %s: profit %s (%s)\n", e.getId(),
                    html(e.getVehicle().getVehicleNumber()), e.getWeekStartDate(), money(e.getNetProfit()),
                    percent(e.getProfitMargin())));
        }
        return sb.toString();
    }

    public String fleetStats(FleetStats stats) {
        StringBuilder sb = new StringBuilder();
        sb.append("📊 <b>Fleet Stats ").append(stats.getWeekStart()).append(" to ").append(stats.getWeekEnd()).append("</b>\n\n");
        sb.append(String.format("- Vehicles: %d (%d active)\n", stats.getTotalVehicles(), stats.getActiveVehicles()));
        sb.append(String.format("- Revenue: %s\n", money(stats.getWeeklyRevenue())));
        sb.append(String.format("- Deductions: %s\n", money(stats.getTotalDeductions())));
        sb.append(String.format("- <b>Net Profit: %s</b>\n", money(stats.getWeeklyProfit())));
        sb.append(String.format("- Average Profit Margin: %s\n", percent(stats.getAverageProfitMargin())));

        if (stats.getTopPerformers().isEmpty()) {
            sb.append("\nNo weekly data submitted for this week yet.");
            return sb.toString();
        }
        sb.append("\n<b>Top Performers:</b>\n");
        int rank = 1;
        for (TopPerformer p : stats.getTopPerformers()) {
            sb.append(String.format("%d. <b>%s</b> (%s): %s\n", rank++, html(p.getVehicleNumber()), html(p.getDriverName()), money(p.getProfit())));
        }
        return sb.toString();
    }

    public String trend(List<TrendPoint> points) {
        if (points.isEmpty()) {
            return "No weekly data found for this trend.";
        }
        StringBuilder sb = new StringBuilder("📈 <b>Trend (oldest first):</b>\n");
        for (TrendPoint p : points) {
            sb.append(String.format("- %s: revenue %s, deductions %s, profit %s (%s)\n", p.getWeek(),
                    money(p.getRevenue()), money(p.getDeductions()), money(p.getProfit()), percent(p.getProfitMargin())));
        }
        return sb.toString();
    }

    /**
     * Keeps "not found", "invalid request" and storage failures apart in what the user sees.
     */
    public String error(Exception e) {
        if (e instanceof NotFoundException) {
            return "❌ Not found: " + html(e.getMessage());
        }
        if (e instanceof ValidationException) {
            return "⚠️ Invalid request: " + html(e.getMessage());
        }
        if (e instanceof StorageException) {
            return "🛑 Storage error, nothing was changed. Please try again later.";
        }
        return "An error occurred: " + html(e.getMessage());
    }

    // Replies use Telegram's HTML parse mode, so every interpolated value is escaped
    static String html(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text);
    }

    public String money(BigDecimal amount) {
        return String.format(Locale.ROOT, "%s%,.2f", properties.getReport().getCurrencySymbol(), amount);
    }

    public String percent(double margin) {
        return String.format(Locale.ROOT, "%.2f%%", margin);
    }
}

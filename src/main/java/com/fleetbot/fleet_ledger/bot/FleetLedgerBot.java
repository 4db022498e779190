package com.fleetbot.fleet_ledger.bot;

import com.fleetbot.fleet_ledger.dto.FleetStats;
import com.fleetbot.fleet_ledger.dto.LedgerEntryFilter;
import com.fleetbot.fleet_ledger.dto.TrendPoint;
import com.fleetbot.fleet_ledger.dto.WeekWindow;
import com.fleetbot.fleet_ledger.dto.WeeklyEntryRequest;
import com.fleetbot.fleet_ledger.exception.NotFoundException;
import com.fleetbot.fleet_ledger.exception.ValidationException;
import com.fleetbot.fleet_ledger.model.Vehicle;
import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;
import com.fleetbot.fleet_ledger.report.CsvReportService;
import com.fleetbot.fleet_ledger.report.ExcelReportService;
import com.fleetbot.fleet_ledger.report.ReportDataService;
import com.fleetbot.fleet_ledger.report.VehicleHistoryReport;
import com.fleetbot.fleet_ledger.report.WeeklyFleetReport;
import com.fleetbot.fleet_ledger.repository.VehicleRepository;
import com.fleetbot.fleet_ledger.service.AggregationService;
import com.fleetbot.fleet_ledger.service.LedgerService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Telegram front end for the ledger. This is the calling layer: it owns conversation state
 * and writes the access events to the AUDIT log.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "telegram.bot.enabled", havingValue = "true")
public class FleetLedgerBot extends TelegramLongPollingBot {

    private static final Logger AUDIT = LoggerFactory.getLogger("AUDIT");

    static final String AWAIT_WEEK_START = "AWAIT_WEEK_START";
    static final String AWAIT_CASH = "AWAIT_CASH";
    static final String AWAIT_ONLINE = "AWAIT_ONLINE";
    static final String AWAIT_DIESEL = "AWAIT_DIESEL";
    static final String AWAIT_TOLLS = "AWAIT_TOLLS";
    static final String AWAIT_MAINTENANCE = "AWAIT_MAINTENANCE";
    static final String AWAIT_OTHER = "AWAIT_OTHER";
    static final String AWAIT_TRIPS = "AWAIT_TRIPS";
    static final String AWAIT_DISTANCE = "AWAIT_DISTANCE";
    static final String AWAIT_RATING = "AWAIT_RATING";
    static final String AWAIT_NOTES = "AWAIT_NOTES";
    static final String AWAIT_DELETE_CONFIRM = "AWAIT_DELETE_CONFIRM";

    private static final String SUBMIT_VEHICLE_PREFIX = "submit_vehicle_";
    private static final String SKIP = "-";

    private final VehicleRepository vehicleRepository;
    private final LedgerService ledgerService;
    private final AggregationService aggregationService;
    private final ReportDataService reportDataService;
    private final ExcelReportService excelReportService;
    private final CsvReportService csvReportService;
    private final ConversationService conversationService;
    private final BotMessages messages;
    private final Clock clock;

    @Value("${telegram.bot.username}")
    private String botUsername;

    public FleetLedgerBot(@Value("${telegram.bot.token}") String botToken,
                          VehicleRepository vehicleRepository,
                          LedgerService ledgerService,
                          AggregationService aggregationService,
                          ReportDataService reportDataService,
                          ExcelReportService excelReportService,
                          CsvReportService csvReportService,
                          ConversationService conversationService,
                          BotMessages messages,
                          Clock clock) {
        super(botToken);
        this.vehicleRepository = vehicleRepository;
        this.ledgerService = ledgerService;
        this.aggregationService = aggregationService;
        this.reportDataService = reportDataService;
        this.excelReportService = excelReportService;
        this.csvReportService = csvReportService;
        this.conversationService = conversationService;
        this.messages = messages;
        this.clock = clock;
    }

    @PostConstruct
    public void registerBot() {
        try {
            TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
            botsApi.registerBot(this);
            log.info(">>> Fleet Ledger bot registered: @{}", getBotUsername());
        } catch (TelegramApiException e) {
            log.error("Failed to register Fleet Ledger bot", e);
        }
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (update.hasMessage() && update.getMessage().hasText()
                && "/cancel".equalsIgnoreCase(update.getMessage().getText().trim())) {
            long chatId = update.getMessage().getChatId();
            conversationService.clear(chatId);
            sendText(chatId, "Operation cancelled.");
            return;
        }

        try {
            if (update.hasMessage() && update.getMessage().hasText()) {
                long chatId = update.getMessage().getChatId();
                String text = update.getMessage().getText();
                String state = conversationService.getState(chatId);
                String user = userRef(update.getMessage().getFrom() == null ? null : update.getMessage().getFrom().getId(), chatId);

                log.info("Received '{}' from chat {} with state {}", text, chatId, state);

                if (state != null) handleConversation(chatId, user, text.trim(), state);
                else if (text.startsWith("/")) handleCommand(chatId, user, text.trim());

            } else if (update.hasCallbackQuery()) {
                handleCallbackQuery(update.getCallbackQuery().getMessage().getChatId(), update.getCallbackQuery().getData());
            }
        } catch (Exception e) {
            log.error("Error processing update: {}", e.getMessage(), e);
            if (update.hasMessage()) sendText(update.getMessage().getChatId(), messages.error(e));
        }
    }

    // --- Commands ---
    private void handleCommand(long chatId, String user, String command) {
        String[] parts = command.split("\\s+");
        try {
            switch (parts[0]) {
                case "/start":
                case "/help":
                    sendText(chatId, BotMessages.HELP);
                    break;
                case "/list_vehicles":
                    sendText(chatId, messages.vehicles(vehicleRepository.findAllByOrderByVehicleNumberAsc()));
                    break;
                case "/submit_week":
                    sendVehiclePicker(chatId);
                    break;
                case "/entries":
                    listEntries(chatId, parts);
                    break;
                case "/delete_entry":
                    askDeleteConfirmation(chatId, parts);
                    break;
                case "/fleet_stats":
                    fleetStats(chatId, parts);
                    break;
                case "/trend":
                    trend(chatId, parts);
                    break;
                case "/weekly_report":
                    weeklyReport(chatId, user, parts);
                    break;
                case "/vehicle_report":
                    vehicleReport(chatId, user, parts);
                    break;
                default:
                    sendText(chatId, "Unknown command. Try /start");
            }
        } catch (NotFoundException | ValidationException e) {
            log.warn("Command {} rejected: {}", parts[0], e.getMessage());
            sendText(chatId, messages.error(e));
        }
    }

    // --- Weekly submission conversation ---
    private void handleConversation(long chatId, String user, String text, String state) {
        try {
            if (AWAIT_DELETE_CONFIRM.equals(state)) {
                confirmDelete(chatId, user, text);
                return;
            }
            WeeklyEntryRequest draft = conversationService.getDraft(chatId, WeeklyEntryRequest.class);
            switch (state) {
                case AWAIT_WEEK_START:
                    // Weekday normalization is the caller's job; the ledger keys on whatever start it gets
                    WeekWindow week = WeekWindow.weekOf(WeekWindow.parseDate(text));
                    draft.setWeekStartDate(week.getStart());
                    draft.setWeekEndDate(week.getEnd());
                    ask(chatId, AWAIT_CASH, "Week " + week.getStart() + " to " + week.getEnd() + ".\n1. Cash collected:");
                    break;
                case AWAIT_CASH:
                    draft.setCashCollected(amount(text));
                    ask(chatId, AWAIT_ONLINE, "2. Online earnings:");
                    break;
                case AWAIT_ONLINE:
                    draft.setOnlineEarnings(amount(text));
                    ask(chatId, AWAIT_DIESEL, "3. Diesel expense:");
                    break;
                case AWAIT_DIESEL:
                    draft.setDieselExpense(amount(text));
                    ask(chatId, AWAIT_TOLLS, "4. Tolls/parking:");
                    break;
                case AWAIT_TOLLS:
                    draft.setTollsParking(amount(text));
                    ask(chatId, AWAIT_MAINTENANCE, "5. Maintenance/repairs:");
                    break;
                case AWAIT_MAINTENANCE:
                    draft.setMaintenanceRepairs(amount(text));
                    ask(chatId, AWAIT_OTHER, "6. Other expenses:");
                    break;
                case AWAIT_OTHER:
                    draft.setOtherExpenses(amount(text));
                    ask(chatId, AWAIT_TRIPS, "7. Number of trips (<code>-</code> to skip):");
                    break;
                case AWAIT_TRIPS:
                    draft.setTotalTrips(SKIP.equals(text) ? null : Integer.valueOf(text));
                    ask(chatId, AWAIT_DISTANCE, "8. Distance driven (<code>-</code> to skip):");
                    break;
                case AWAIT_DISTANCE:
                    draft.setTotalDistance(SKIP.equals(text) ? null : amount(text));
                    ask(chatId, AWAIT_RATING, "9. Average rating 0-5 (<code>-</code> to skip):");
                    break;
                case AWAIT_RATING:
                    draft.setAverageRating(SKIP.equals(text) ? null : Double.valueOf(text));
                    ask(chatId, AWAIT_NOTES, "10. Notes (<code>-</code> to skip):");
                    break;
                case AWAIT_NOTES:
                    draft.setNotes(SKIP.equals(text) ? null : text);
                    submit(chatId, user, draft);
                    break;
                default:
                    conversationService.clear(chatId);
            }
        } catch (NumberFormatException e) {
            sendText(chatId, "Invalid number. Please try again. Use /cancel to stop.");
        } catch (ValidationException e) {
            sendText(chatId, messages.error(e) + "\nPlease try again. Use /cancel to stop.");
        } catch (NotFoundException e) {
            conversationService.clear(chatId);
            sendText(chatId, messages.error(e));
        }
    }

    private void submit(long chatId, String user, WeeklyEntryRequest draft) {
        try {
            WeeklyLedgerEntry saved = ledgerService.upsertWeeklyEntry(draft, user);
            AUDIT.info("user={} action=LEDGER_UPSERT entry={} vehicle={} week={}",
                    user, saved.getId(), saved.getVehicle().getVehicleNumber(), saved.getWeekStartDate());
            sendText(chatId, messages.entrySaved(saved));
        } catch (ValidationException e) {
            sendText(chatId, messages.error(e) + "\nUse /submit_week to start again.");
        } finally {
            conversationService.clear(chatId);
        }
    }

    private void handleCallbackQuery(long chatId, String data) {
        if (data.startsWith(SUBMIT_VEHICLE_PREFIX)) {
            Long vehicleId = Long.parseLong(data.substring(SUBMIT_VEHICLE_PREFIX.length()));
            Vehicle vehicle = vehicleRepository.findById(vehicleId).orElse(null);
            if (vehicle == null) {
                sendText(chatId, "Error: Vehicle not found.");
                return;
            }
            WeeklyEntryRequest draft = new WeeklyEntryRequest();
            draft.setVehicleId(vehicleId);
            conversationService.begin(chatId, AWAIT_WEEK_START, draft);
            sendText(chatId, "--- Weekly data for <b>" + BotMessages.html(vehicle.getVehicleNumber()) + "</b> ---\n" +
                    "Enter any date in the week (<code>YYYY-MM-DD</code>):");
        }
    }

    private void sendVehiclePicker(long chatId) {
        List<Vehicle> vehicles = vehicleRepository.findAllByOrderByVehicleNumberAsc();
        if (vehicles.isEmpty()) {
            sendText(chatId, "No vehicles registered yet.");
            return;
        }
        InlineKeyboardMarkup.InlineKeyboardMarkupBuilder kb = InlineKeyboardMarkup.builder();
        for (Vehicle v : vehicles) {
            kb.keyboardRow(List.of(
                    InlineKeyboardButton.builder()
                            .text(v.getVehicleNumber() + " - " + v.getDriverName())
                            .callbackData(SUBMIT_VEHICLE_PREFIX + v.getId())
                            .build()
            ));
        }
        sendReplyMarkup(chatId, "Please select a vehicle:", kb.build());
    }

    // --- Entries ---
    private void listEntries(long chatId, String[] parts) {
        LocalDate date = parts.length > 1 ? WeekWindow.parseDate(parts[1]) : LocalDate.now(clock);
        WeekWindow window = WeekWindow.weekOf(date);
        List<WeeklyLedgerEntry> entries = ledgerService.getWeeklyEntries(LedgerEntryFilter.builder()
                .weekStart(window.getStart())
                .weekEnd(window.getEnd())
                .build());
        sendText(chatId, messages.entries(window, entries));
    }

    private void askDeleteConfirmation(long chatId, String[] parts) {
        if (parts.length < 2) {
            throw new ValidationException("Usage: /delete_entry <id>");
        }
        Long entryId = parseId(parts[1]);
        WeeklyLedgerEntry entry = ledgerService.getWeeklyEntry(entryId);
        conversationService.begin(chatId, AWAIT_DELETE_CONFIRM, entryId);
        sendText(chatId, "⚠️ Are you sure you want to delete the week of <b>" + entry.getWeekStartDate() +
                "</b> for <b>" + BotMessages.html(entry.getVehicle().getVehicleNumber()) + "</b>?\n" +
                "Type <code>YES</code> to confirm.");
    }

    private void confirmDelete(long chatId, String user, String text) {
        Long entryId = conversationService.getDraft(chatId, Long.class);
        conversationService.clear(chatId);
        if (!"YES".equals(text)) {
            sendText(chatId, "Deletion cancelled.");
            return;
        }
        ledgerService.deleteWeeklyEntry(entryId);
        AUDIT.info("user={} action=LEDGER_DELETE entry={}", user, entryId);
        sendText(chatId, "✅ Weekly entry #" + entryId + " has been deleted.");
    }

    // --- Dashboard ---
    private void fleetStats(long chatId, String[] parts) {
        LocalDate weekStart = parts.length > 1 ? WeekWindow.parseDate(parts[1]) : null;
        FleetStats stats = aggregationService.getFleetStats(weekStart);
        sendText(chatId, messages.fleetStats(stats));
    }

    private void trend(long chatId, String[] parts) {
        Integer weeks = null;
        Long vehicleId = null;
        if (parts.length > 1) {
            try {
                weeks = Integer.valueOf(parts[1]);
            } catch (NumberFormatException e) {
                throw new ValidationException("Number of weeks must be a whole number");
            }
        }
        if (parts.length > 2) {
            vehicleId = findVehicle(parts[2]).getId();
        }
        List<TrendPoint> points = aggregationService.getTrend(vehicleId, weeks);
        sendText(chatId, messages.trend(points));
    }

    // --- Reports ---
    private void weeklyReport(long chatId, String user, String[] parts) {
        LocalDate start = parts.length > 1 ? WeekWindow.parseDate(parts[1]) : null;
        LocalDate end = parts.length > 2 ? WeekWindow.parseDate(parts[2]) : null;

        WeekWindow window = reportDataService.weeklyWindow(start, end);
        WeeklyFleetReport report = reportDataService.buildWeeklyReport(window);
        byte[] workbook = excelReportService.renderWeeklyReport(report);
        AUDIT.info("user={} action=REPORT_DOWNLOAD type=weekly window={}..{}", user, window.getStart(), window.getEnd());
        sendDocument(chatId, workbook, ExcelReportService.weeklyFileName(window), ExcelReportService.weeklyTitle(window));

        try {
            byte[] csv = csvReportService.generateWeeklyReportCsv(report);
            sendDocument(chatId, csv, CsvReportService.weeklyFileName(report), "CSV version");
        } catch (IOException e) {
            log.error("Failed to generate weekly CSV report: {}", e.getMessage(), e);
            sendText(chatId, "Could not generate CSV file.");
        }
    }

    private void vehicleReport(long chatId, String user, String[] parts) {
        if (parts.length < 4) {
            throw new ValidationException("Start date and end date are required. Usage: " +
                    "/vehicle_report <vehicle#> <YYYY-MM-DD> <YYYY-MM-DD>");
        }
        Vehicle vehicle = findVehicle(parts[1]);
        VehicleHistoryReport report = reportDataService.buildVehicleReport(vehicle.getId(),
                WeekWindow.parseDate(parts[2]), WeekWindow.parseDate(parts[3]));
        byte[] workbook = excelReportService.renderVehicleReport(report);
        AUDIT.info("user={} action=REPORT_DOWNLOAD type=vehicle vehicle={} window={}..{}", user,
                vehicle.getVehicleNumber(), report.getWindow().getStart(), report.getWindow().getEnd());
        sendDocument(chatId, workbook, ExcelReportService.vehicleFileName(vehicle),
                report.getEntries().size() + " week(s) for " + vehicle.getVehicleNumber());
    }

    // --- Helpers ---
    private Vehicle findVehicle(String vehicleNumber) {
        return vehicleRepository.findByVehicleNumberIgnoreCase(vehicleNumber.trim())
                .orElseThrow(() -> NotFoundException.vehicle(vehicleNumber));
    }

    private void ask(long chatId, String nextState, String question) {
        conversationService.moveTo(chatId, nextState);
        sendText(chatId, question);
    }

    private static BigDecimal amount(String text) {
        BigDecimal value = new BigDecimal(text.replace(",", ""));
        if (value.signum() < 0) {
            throw new ValidationException("Amounts must not be negative");
        }
        if (value.scale() > 2) {
            throw new ValidationException("Amounts can have at most 2 decimals");
        }
        return value;
    }

    private static Long parseId(String text) {
        try {
            return Long.valueOf(text);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid entry id '" + text + "'");
        }
    }

    static String userRef(Long telegramUserId, long chatId) {
        return "telegram:" + (telegramUserId != null ? telegramUserId : chatId);
    }

    private void sendText(long chatId, String text) {
        SendMessage message = SendMessage.builder()
                .chatId(chatId)
                .text(text)
                .parseMode("HTML")
                .build();
        executeMessage(message);
    }

    private void sendReplyMarkup(long chatId, String text, InlineKeyboardMarkup markup) {
        SendMessage message = SendMessage.builder()
                .chatId(chatId)
                .text(text)
                .replyMarkup(markup)
                .build();
        executeMessage(message);
    }

    private void sendDocument(long chatId, byte[] content, String fileName, String caption) {
        SendDocument document = SendDocument.builder()
                .chatId(chatId)
                .document(new InputFile(new ByteArrayInputStream(content), fileName))
                .caption(caption)
                .build();
        try {
            execute(document);
        } catch (TelegramApiException e) {
            log.error("Failed to send document {}: {}", fileName, e.getMessage(), e);
        }
    }

    private void executeMessage(SendMessage message) {
        try {
            execute(message);
        } catch (TelegramApiException e) {
            log.error("Failed to send message: {}", e.getMessage());
        }
    }
}

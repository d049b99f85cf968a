package prayer.devotions_be.reminders;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/users/{userId}/reminders")
@Tag(name = "Reminders", description = "Daily prayer reminders of a user")
public class ReminderController {
    private final ReminderService service;
    private final ReminderDispatchService dispatchService;

    public ReminderController(ReminderService service, ReminderDispatchService dispatchService) {
        this.service = service;
        this.dispatchService = dispatchService;
    }

    @PostMapping
    @Operation(summary = "Create reminder", description = "Schedules a daily reminder at a quarter-hour time in the given time zone.")
    @ApiResponse(responseCode = "201", description = "Reminder was created.")
    public ResponseEntity<ReminderResponse> create(@Parameter(description = "Owner of the reminder") @PathVariable String userId,
                                                   @RequestBody ReminderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.add(userId, request));
    }

    @GetMapping
    @Operation(summary = "List reminders")
    public List<ReminderResponse> list(@PathVariable String userId) {
        return service.list(userId);
    }

    @DeleteMapping("/{reminderId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete reminder")
    public void delete(@PathVariable String userId, @PathVariable String reminderId) {
        service.delete(userId, reminderId);
    }

    @PutMapping("/timezone")
    @Operation(summary = "Change time zone", description = "Moves all reminders of the user to another zone, keeping their local times.")
    public TimezoneUpdateResponse updateTimezone(@PathVariable String userId, @RequestBody TimezoneUpdateRequest request) {
        return service.updateTimezone(userId, request == null ? null : request.timezone());
    }

    @PostMapping("/force-send")
    @Operation(summary = "Send reminders now", description = "Sends every reminder of the user immediately without rescheduling. Intended for diagnostics.")
    @ApiResponse(responseCode = "404", description = "The user has no reminders.")
    public DispatchSummary forceSend(@PathVariable String userId) {
        return dispatchService.forceSendForUser(userId);
    }
}

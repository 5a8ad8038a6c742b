package habitkit.demo;

import habitkit.HabitSnapshot;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.Map;
import java.util.NoSuchElementException;

@RestController
@RequestMapping("/api/habits")
public class HabitController {

    private final HabitService habits;

    public HabitController(HabitService habits) {
        this.habits = habits;
    }

    public record CreateHabit(String userId, String name, String type, Double targetValue) {
    }

    public record CompleteHabit(LocalDate date, Double currentValue, String userId) {
    }

    public record UpdateHabit(String name, Double targetValue, String userId) {
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public HabitSnapshot create(@RequestBody CreateHabit request) {
        return habits.create(request.userId(), request.name(), request.type(), request.targetValue());
    }

    @PostMapping("/{id}/complete")
    public HabitService.Completion complete(@PathVariable String id,
                                            @RequestBody(required = false) CompleteHabit request) {
        CompleteHabit body = request == null ? new CompleteHabit(null, null, null) : request;
        return habits.complete(id, body.date(), body.currentValue(), body.userId());
    }

    @PutMapping("/{id}")
    public HabitSnapshot update(@PathVariable String id, @RequestBody UpdateHabit request) {
        return habits.update(id, request.name(), request.targetValue(), request.userId());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id, @RequestParam(required = false) String userId) {
        habits.delete(id, userId);
    }

    @GetMapping("/{id}")
    public HabitSnapshot get(@PathVariable String id) {
        return habits.get(id);
    }

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, String> notFound(NoSuchElementException e) {
        return Map.of("error", e.getMessage());
    }
}

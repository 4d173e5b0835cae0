package com.gt.vsrs.card;

import com.gt.vsrs.exception.ValidationException;
import com.gt.vsrs.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/rest/cards")
public class CardController {

    private static final Logger log = LoggerFactory.getLogger(CardController.class);

    private final CardStore cardStore;

    public CardController(CardStore cardStore) {
        this.cardStore = cardStore;
    }

    @GetMapping(value = "/counts", produces = "application/json")
    public CardCounts getCounts() {
        return cardStore.counts(Instant.now());
    }

    @PostMapping(value = "/items", consumes = "application/json", produces = "application/json")
    public CreatedItem createItem(@RequestBody CreateItemRequest request) {
        Language language = parseLanguage(request.language());

        return cardStore.create(new ItemDefaults(request.text(), request.translation(), language, request.chapter(),
                request.group(), request.sentence()), Instant.now());
    }

    @GetMapping(value = "/items", produces = "application/json")
    public List<Item> getItems() {
        return cardStore.loadAllItems();
    }

    @GetMapping(value = "/chapters", produces = "application/json")
    public List<String> getChapters() {
        return cardStore.listChapters();
    }

    @GetMapping(value = "/lastGroup", produces = "application/json")
    public LastGroupResponse getLastGroup(@RequestParam(value = "chapter") String chapter) {
        return new LastGroupResponse(chapter, cardStore.lastGroupForChapter(chapter));
    }

    @PostMapping(value = "/correction", consumes = "application/json", produces = "application/json")
    public Item applyCorrection(@RequestBody CorrectionRequest request) {
        return cardStore.correctContent(request.itemId(), ContentCorrection.fromNullable(request.text(), request.translation()));
    }

    @DeleteMapping("/items/{id}")
    public void deleteItem(@PathVariable("id") String itemId,
                           @RequestParam(value = "confirm", defaultValue = "false") boolean confirm) {
        requireConfirmation(confirm);
        cardStore.delete(itemId);
    }

    @DeleteMapping("/items")
    public void deleteAllItems(@RequestParam(value = "confirm", defaultValue = "false") boolean confirm) {
        requireConfirmation(confirm);
        log.warn("Deleting all items");
        cardStore.deleteAll();
    }

    private static void requireConfirmation(boolean confirm) {
        if (!confirm) {
            throw new ValidationException("Deletion must be confirmed");
        }
    }

    private static Language parseLanguage(String language) {
        try {
            return Language.fromName(language);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(ex.getMessage(), ex);
        }
    }

    private record CreateItemRequest(String text, String translation, String language, String chapter, String group, String sentence) { }

    private record CorrectionRequest(String itemId, String text, String translation) { }

    private record LastGroupResponse(String chapter, String group) { }
}

package com.gt.vsrs.review;

import com.gt.vsrs.model.ReviewEvent;

import java.util.Collection;
import java.util.List;
import java.util.Set;

public interface ReviewEventDao {

    int appendReviewEvent(ReviewEvent event);

    Set<String> getExistingReviewEventIds(Collection<String> ids);

    List<ReviewEvent> loadReviewEventsForRecord(String recordId);

    List<ReviewEvent> loadAllReviewEvents();

    int deleteReviewEventsForItem(String itemId);

    void deleteAllReviewEvents();
}

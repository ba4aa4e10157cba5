package com.title.reconciliation.review;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ReviewQueue}.
 * Suitable for testing and single-JVM deployments.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        items.put(item.getId(), item);
        log.debug("Submitted review item {} (kind={}, person={}, reason={})",
                item.getId(), item.getKind(), item.getPersonId(), item.getReason());
        return item;
    }

    @Override
    public List<ReviewItem> getPending() {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .toList();
    }

    @Override
    public List<ReviewItem> getPendingForJob(String jobId) {
        return items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(item -> jobId.equals(item.getJobId()))
                .sorted(Comparator.comparing(ReviewItem::getSubmittedAt))
                .toList();
    }

    @Override
    public void approve(String reviewId, String reviewerId, String notes) {
        require(reviewId).markReviewed(ReviewStatus.APPROVED, reviewerId, notes);
        log.info("Review item {} approved by {}", reviewId, reviewerId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        require(reviewId).markReviewed(ReviewStatus.REJECTED, reviewerId, notes);
        log.info("Review item {} rejected by {}", reviewId, reviewerId);
    }

    @Override
    public ReviewItem get(String reviewId) {
        return items.get(reviewId);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private ReviewItem require(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        return item;
    }
}

package com.title.reconciliation.review;

import java.util.List;

/**
 * Manual review queue for records the engine could not settle on its own.
 */
public interface ReviewQueue {

    /**
     * Submits a review item to the queue.
     *
     * @param item the review item to submit
     * @return the submitted item
     */
    ReviewItem submit(ReviewItem item);

    /**
     * Pending items, oldest first.
     */
    List<ReviewItem> getPending();

    /**
     * Pending items raised by the given job, oldest first.
     */
    List<ReviewItem> getPendingForJob(String jobId);

    /**
     * Accepts the proposed value.
     *
     * @throws IllegalArgumentException when no item has the id
     * @throws IllegalStateException    when the item was already reviewed
     */
    void approve(String reviewId, String reviewerId, String notes);

    /**
     * Keeps the current value.
     *
     * @throws IllegalArgumentException when no item has the id
     * @throws IllegalStateException    when the item was already reviewed
     */
    void reject(String reviewId, String reviewerId, String notes);

    /**
     * @return the review item, or null if not found
     */
    ReviewItem get(String reviewId);

    long countPending();
}

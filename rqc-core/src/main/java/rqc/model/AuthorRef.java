package rqc.model;

/**
 * A submission author and their position in the author list (1-based).
 */
public record AuthorRef(PersonRef person, int order) {
}

package xyz.jphil.pdf_annotate.tools.pipeline;

/**
 * Hands out page numbers in pipeline order. Used on the dispatching thread only,
 * so numbers never depend on task completion order.
 */
public class PageNumberSequence {

    private int next;

    public PageNumberSequence(int start) {
        this.next = start;
    }

    public int next() {
        return next++;
    }
}

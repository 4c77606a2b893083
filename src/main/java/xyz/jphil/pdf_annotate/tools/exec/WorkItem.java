package xyz.jphil.pdf_annotate.tools.exec;

/**
 * One schedulable unit of work. The label is used for logging and error messages.
 */
public record WorkItem(String label, Action action) {

    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }

    public static WorkItem of(String label, Action action) {
        return new WorkItem(label, action);
    }

    @Override
    public String toString() {
        return label;
    }
}

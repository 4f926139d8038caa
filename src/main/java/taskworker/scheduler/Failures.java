package taskworker.scheduler;

final class Failures {

    private Failures() {
    }

    /** The message stored for a failed run */
    static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }

    /** Out of memory and stack overflow are not handler outcomes, let them reach the thread */
    static void rethrowIfFatal(Throwable e) {
        if (e instanceof VirtualMachineError) {
            throw (VirtualMachineError) e;
        }
    }
}

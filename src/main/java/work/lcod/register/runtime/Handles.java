package work.lcod.register.runtime;

final class Handles {
    private Handles() {}

    static void dispose(Object instance) {
        if (instance instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (RuntimeException ex) {
                throw ex;
            } catch (Exception ex) {
                throw new IllegalStateException("Unable to release " + instance.getClass().getName() + ": " + ex.getMessage(), ex);
            }
        }
    }
}

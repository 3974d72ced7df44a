package net.jobclaim.core.error;

public class DuplicateJobException extends PersistenceException {
    private final String jobName;

    public DuplicateJobException(String jobName, Throwable cause) {
        super("job name already exists: " + jobName, cause);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}

package net.cadence.bootstrap.props;

import net.cadence.core.maintenance.RetentionUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("cadence")
public class CadenceProperties {
    /** Time zone recurrence rules are evaluated in. */
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Notification notification = new Notification();
    private Retention retention = new Retention();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Notification getNotification() {
        return notification;
    }

    public void setNotification(Notification notification) {
        this.notification = notification;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long tickDelayMs = 3000;
        private long maintenanceDelayMs = 3_600_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }
    }

    public static class Notification {
        private String from = "cadence@localhost";
        private String subjectPrefix = "";
        /** {@code {id}} is replaced with the log id. */
        private String logUrlPattern = "log #{id}";

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public String getSubjectPrefix() {
            return subjectPrefix;
        }

        public void setSubjectPrefix(String subjectPrefix) {
            this.subjectPrefix = subjectPrefix;
        }

        public String getLogUrlPattern() {
            return logUrlPattern;
        }

        public void setLogUrlPattern(String logUrlPattern) {
            this.logUrlPattern = logUrlPattern;
        }
    }

    public static class Retention {
        private boolean enabled = false;
        private int amount = 4;
        private RetentionUnit unit = RetentionUnit.WEEKS;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getAmount() {
            return amount;
        }

        public void setAmount(int amount) {
            this.amount = amount;
        }

        public RetentionUnit getUnit() {
            return unit;
        }

        public void setUnit(RetentionUnit unit) {
            this.unit = unit;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    public static class JobDef {
        private String name;
        private String frequency = "DAILY";
        private String params = "";
        private String command;
        private String shellCommand;
        private boolean runInShell = false;
        private String args = "";
        private boolean disabled = false;
        private List<SubscriberDef> infoSubscribers = new ArrayList<>();
        private List<SubscriberDef> errorSubscribers = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getFrequency() {
            return frequency;
        }

        public void setFrequency(String frequency) {
            this.frequency = frequency;
        }

        public String getParams() {
            return params;
        }

        public void setParams(String params) {
            this.params = params;
        }

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public String getShellCommand() {
            return shellCommand;
        }

        public void setShellCommand(String shellCommand) {
            this.shellCommand = shellCommand;
        }

        public boolean isRunInShell() {
            return runInShell;
        }

        public void setRunInShell(boolean runInShell) {
            this.runInShell = runInShell;
        }

        public String getArgs() {
            return args;
        }

        public void setArgs(String args) {
            this.args = args;
        }

        public boolean isDisabled() {
            return disabled;
        }

        public void setDisabled(boolean disabled) {
            this.disabled = disabled;
        }

        public List<SubscriberDef> getInfoSubscribers() {
            return infoSubscribers;
        }

        public void setInfoSubscribers(List<SubscriberDef> infoSubscribers) {
            this.infoSubscribers = infoSubscribers;
        }

        public List<SubscriberDef> getErrorSubscribers() {
            return errorSubscribers;
        }

        public void setErrorSubscribers(List<SubscriberDef> errorSubscribers) {
            this.errorSubscribers = errorSubscribers;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", frequency='" + frequency + '\'' +
                    ", params='" + params + '\'' +
                    ", command='" + command + '\'' +
                    ", shellCommand='" + shellCommand + '\'' +
                    ", disabled=" + disabled +
                    '}';
        }
    }

    public static class SubscriberDef {
        private String username;
        private String fullName;
        private String email;

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getFullName() {
            return fullName;
        }

        public void setFullName(String fullName) {
            this.fullName = fullName;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }
    }
}

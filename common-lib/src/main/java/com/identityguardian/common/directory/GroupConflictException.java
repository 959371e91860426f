package com.identityguardian.common.directory;

/**
 * The directory refused to create a group because one with the same display name
 * already exists. Callers recover by re-querying the group by name.
 */
public class GroupConflictException extends DirectoryException {
    private final String displayName;

    public GroupConflictException(String displayName) {
        super("Group already exists: " + displayName);
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}

package org.example.pdfchat.entity;

/**
 * 项目状态机：CREATING -> CREATED / FAILED，只有 FAILED 可以通过重新提交回到 CREATING
 */
public enum ProjectStatus {
    CREATING,
    CREATED,
    FAILED;

    public boolean canTransitionTo(ProjectStatus target) {
        switch (this) {
            case CREATING:
                return true;
            case FAILED:
                return target == CREATING || target == FAILED;
            default:
                return target == CREATED;
        }
    }
}

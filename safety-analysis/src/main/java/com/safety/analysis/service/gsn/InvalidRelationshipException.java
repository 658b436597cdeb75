package com.safety.analysis.service.gsn;

/**
 * GSN 连接不合法
 */
public class InvalidRelationshipException extends IllegalArgumentException {

    private final String parentId;
    private final String childId;
    private final GsnRelation relation;

    public InvalidRelationshipException(String parentId, String childId, GsnRelation relation, String reason) {
        super("Invalid " + relation.getValue() + " relationship " + parentId + " -> " + childId + ": " + reason);
        this.parentId = parentId;
        this.childId = childId;
        this.relation = relation;
    }

    public String getParentId() {
        return parentId;
    }

    public String getChildId() {
        return childId;
    }

    public GsnRelation getRelation() {
        return relation;
    }
}

package com.safety.analysis.service.gsn;

import lombok.Getter;
import lombok.Setter;

/**
 * GSN 节点
 *
 * 父子关系和 context 标记统一由 {@link GsnArgumentGraph} 维护，这里只保存节点属性。
 */
@Getter
@Setter
public class GsnNode {
    private String uniqueId;
    private String userName;
    private GsnNodeType nodeType;
    private String description = "";

    /** SPI 目标（Solution 使用） */
    private String spiTarget = "";

    /** 证据所属工作产品 */
    private String workProduct = "";

    private String evidenceLink = "";

    private boolean primaryInstance = true;

    /** 克隆节点指向的原始节点ID */
    private String originalId;

    private double x = 50;
    private double y = 50;

    public GsnNode() {
    }

    public GsnNode(String uniqueId, String userName, GsnNodeType nodeType) {
        this.uniqueId = uniqueId;
        this.userName = userName;
        this.nodeType = nodeType;
    }

    public void setDescription(String description) {
        this.description = description != null ? description : "";
    }

    public void setSpiTarget(String spiTarget) {
        this.spiTarget = spiTarget != null ? spiTarget : "";
    }

    public void setWorkProduct(String workProduct) {
        this.workProduct = workProduct != null ? workProduct : "";
    }

    public void setEvidenceLink(String evidenceLink) {
        this.evidenceLink = evidenceLink != null ? evidenceLink : "";
    }
}

package com.safety.analysis.service.gsn;

import lombok.Getter;
import lombok.Setter;

/**
 * 节点属性修改内容，为 null 的字段保持不变
 */
@Getter
@Setter
public class GsnNodeDetails {
    private String userName;
    private String description;
    private String workProduct;
    private String evidenceLink;
    private String spiTarget;
}

package com.ai.leasing.entity;

/**
 * Enum persisted by its lowercase wire code rather than its Java name.
 */
public interface CodedEnum {

    String code();
}

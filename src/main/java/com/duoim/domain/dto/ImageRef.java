package com.duoim.domain.dto;

/**
 * 对象存储里的一张图片：url 用于展示，objectId 用于对象存储侧的生命周期管理。
 */
public record ImageRef(String url, String objectId) {
}

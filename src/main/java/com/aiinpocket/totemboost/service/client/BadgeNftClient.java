package com.aiinpocket.totemboost.service.client;

/**
 * 里程碑徽章 NFT 合約。
 */
public interface BadgeNftClient {

    /**
     * @param badgeContract 徽章合約地址（由管理員設定）
     * @param user          接收者
     * @param milestoneId   里程碑天數
     */
    void mint(String badgeContract, String user, int milestoneId);
}

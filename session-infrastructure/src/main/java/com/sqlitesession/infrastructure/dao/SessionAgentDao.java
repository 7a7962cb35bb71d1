package com.sqlitesession.infrastructure.dao;

import com.sqlitesession.infrastructure.dao.po.SessionAgentPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 会话 Agent DAO
 */
@Mapper
public interface SessionAgentDao {

    int insert(SessionAgentPO po);

    /**
     * 覆盖 data 并刷新 updated_at
     */
    int update(SessionAgentPO po);

    SessionAgentPO selectById(@Param("sessionId") String sessionId, @Param("agentId") String agentId);

    int countById(@Param("sessionId") String sessionId, @Param("agentId") String agentId);
}

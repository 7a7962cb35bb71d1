package com.sqlitesession.infrastructure.dao;

import com.sqlitesession.infrastructure.dao.po.MultiAgentStatePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * Multi-agent 状态 DAO
 */
@Mapper
public interface MultiAgentStateDao {

    int insert(MultiAgentStatePO po);

    int update(MultiAgentStatePO po);

    MultiAgentStatePO selectById(@Param("sessionId") String sessionId, @Param("multiAgentId") String multiAgentId);

    int countById(@Param("sessionId") String sessionId, @Param("multiAgentId") String multiAgentId);
}

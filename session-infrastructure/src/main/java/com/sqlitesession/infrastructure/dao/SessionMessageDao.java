package com.sqlitesession.infrastructure.dao;

import com.sqlitesession.infrastructure.dao.po.SessionMessagePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 会话消息 DAO
 */
@Mapper
public interface SessionMessageDao {

    int insert(SessionMessagePO po);

    int update(SessionMessagePO po);

    SessionMessagePO selectById(@Param("sessionId") String sessionId,
                                @Param("agentId") String agentId,
                                @Param("messageId") Integer messageId);

    int countById(@Param("sessionId") String sessionId,
                  @Param("agentId") String agentId,
                  @Param("messageId") Integer messageId);

    /**
     * 按 message_id 升序查询，limit 为空时不分页
     */
    List<SessionMessagePO> selectByAgent(@Param("sessionId") String sessionId,
                                         @Param("agentId") String agentId,
                                         @Param("limit") Integer limit,
                                         @Param("offset") Integer offset);
}

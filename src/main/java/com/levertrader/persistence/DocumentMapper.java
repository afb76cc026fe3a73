package com.levertrader.persistence;

import com.levertrader.domain.model.Account;
import com.levertrader.domain.model.Position;
import com.levertrader.domain.model.TradeRequest;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between domain objects and their stored documents.
 *
 * <p>Field names match one to one; only {@code lastUpdated} is document-only and is stamped by
 * the gateway on every write.
 */
@Mapper
public interface DocumentMapper {

    @Mapping(target = "lastUpdated", ignore = true)
    AccountDocument toDocument(Account account);

    Account toDomain(AccountDocument document);

    @Mapping(target = "lastUpdated", ignore = true)
    PositionDocument toDocument(Position position);

    Position toDomain(PositionDocument document);

    List<Position> toDomainList(List<PositionDocument> documents);

    @Mapping(target = "lastUpdated", ignore = true)
    OrderDocument toDocument(TradeRequest tradeRequest);
}

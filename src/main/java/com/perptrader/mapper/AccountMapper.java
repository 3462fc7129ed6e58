package com.perptrader.mapper;

import com.perptrader.domain.model.Account;
import com.perptrader.entity.AccountEntity;
import org.mapstruct.Mapper;

@Mapper
public interface AccountMapper {

    AccountEntity toEntity(Account account);

    Account toDomain(AccountEntity entity);
}

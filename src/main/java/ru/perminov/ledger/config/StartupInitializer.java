package ru.perminov.ledger.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.perminov.ledger.model.Currency;
import ru.perminov.ledger.model.InvestmentType;
import ru.perminov.ledger.repository.CurrencyRepository;
import ru.perminov.ledger.repository.InvestmentTypeRepository;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class StartupInitializer {

    private final CurrencyRepository currencyRepository;
    private final InvestmentTypeRepository investmentTypeRepository;

    @Value("${ledger.seed.enabled:true}")
    private boolean seedEnabled;

    @Bean
    public ApplicationRunner seedReferenceData() {
        return args -> {
            if (!seedEnabled) {
                log.info("Reference data seeding disabled");
                return;
            }
            if (!currencyRepository.existsByCode(Currency.BASE_CODE)) {
                currencyRepository.save(new Currency(null, Currency.BASE_CODE, "Pound Sterling"));
                log.info("Base currency {} created", Currency.BASE_CODE);
            }

            setTypeIfMissing("SHARE", "Shares", "Shares listed on a stock exchange");
            setTypeIfMissing("FUND", "Funds", "Unit trusts and OEICs");
            setTypeIfMissing("TRUST", "Investment Trusts", "Closed-ended investment companies");
            setTypeIfMissing("BOND", "Bonds", "Government and corporate bonds");
            setTypeIfMissing("OTHER", "Other", null);
        };
    }

    private void setTypeIfMissing(String shortDescription, String description, String usageNotes) {
        if (investmentTypeRepository.findByShortDescription(shortDescription).isEmpty()) {
            investmentTypeRepository.save(new InvestmentType(null, shortDescription, description, usageNotes));
            log.info("Investment type {} created", shortDescription);
        }
    }
}

package com.landdev.cashflow.infrastructure.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.landdev.cashflow.domain.exception.ValidationException;
import com.landdev.cashflow.domain.model.AcquisitionCost;
import com.landdev.cashflow.domain.model.BudgetItem;
import com.landdev.cashflow.domain.model.Container;
import com.landdev.cashflow.domain.model.Loan;
import com.landdev.cashflow.domain.model.ParcelSale;
import com.landdev.cashflow.domain.model.ProjectAssumptions;
import com.landdev.cashflow.domain.provider.BudgetItemProvider;
import com.landdev.cashflow.domain.provider.ContainerHierarchyProvider;
import com.landdev.cashflow.domain.provider.LoanProvider;
import com.landdev.cashflow.domain.provider.ParcelSaleProvider;
import com.landdev.cashflow.domain.provider.ProjectAssumptionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-only project data backed by JSON datasets, one document per project
 *
 * Configuration:
 * - app.data.source.type: "json" (default)
 * - app.data.location: resource pattern of the dataset files, classpath or file system
 *   (default classpath*:datasets/*.json)
 *
 * Datasets are loaded once at startup and served from memory. Records are handed out as stored;
 * the engine never mutates its inputs.
 */
@Component
@ConditionalOnProperty(
        name = "app.data.source.type",
        havingValue = "json",
        matchIfMissing = true
)
public class JsonProjectDataStore implements ProjectAssumptionProvider, BudgetItemProvider, ParcelSaleProvider,
        LoanProvider, ContainerHierarchyProvider {

    private static final Logger log = LoggerFactory.getLogger(JsonProjectDataStore.class);

    private final ObjectMapper objectMapper;
    private final Map<Long, ProjectDataset> datasets = new ConcurrentHashMap<>();

    public JsonProjectDataStore(ObjectMapper objectMapper,
                                @Value("${app.data.location:classpath*:datasets/*.json}") String location) {
        this.objectMapper = objectMapper;
        loadDatasets(location);
    }

    private void loadDatasets(String location) {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(location);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list project datasets at " + location, e);
        }
        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                addDataset(objectMapper.readValue(in, ProjectDataset.class));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read project dataset " + resource.getDescription(), e);
            }
        }
        log.info("Loaded {} project datasets from {}", datasets.size(), location);
    }

    /**
     * Register a dataset, replacing any dataset of the same project
     */
    public void addDataset(ProjectDataset dataset) {
        if (dataset.getProject() == null || dataset.getProject().getProjectId() == null) {
            throw new ValidationException("Project dataset without a project id");
        }
        datasets.put(dataset.getProject().getProjectId(), dataset);
        log.debug("Registered dataset for project {}", dataset.getProject().getProjectId());
    }

    public void removeDataset(Long projectId) {
        datasets.remove(projectId);
    }

    public int size() {
        return datasets.size();
    }

    @Override
    public Optional<ProjectAssumptions> findAssumptions(Long projectId) {
        return Optional.ofNullable(datasets.get(projectId)).map(ProjectDataset::getProject);
    }

    @Override
    public List<BudgetItem> findBudgetItems(Long projectId) {
        return dataset(projectId).map(ProjectDataset::getBudgetItems).orElse(List.of());
    }

    @Override
    public List<AcquisitionCost> findAcquisitionCosts(Long projectId) {
        return dataset(projectId).map(ProjectDataset::getAcquisitionCosts).orElse(List.of());
    }

    @Override
    public List<ParcelSale> findParcelSales(Long projectId) {
        return dataset(projectId).map(ProjectDataset::getParcelSales).orElse(List.of());
    }

    @Override
    public List<Loan> findLoans(Long projectId) {
        return dataset(projectId).map(ProjectDataset::getLoans).orElse(List.of());
    }

    @Override
    public List<Container> findContainers(Long projectId) {
        return dataset(projectId).map(ProjectDataset::getContainers).orElse(List.of());
    }

    private Optional<ProjectDataset> dataset(Long projectId) {
        return Optional.ofNullable(datasets.get(projectId));
    }
}

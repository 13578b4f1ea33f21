package com.dedicatedcode.geomesh.service.query;

import com.dedicatedcode.geomesh.GeomeshFixture;
import com.dedicatedcode.geomesh.dto.AssetFilterRequest;
import com.dedicatedcode.geomesh.dto.AssetMatch;
import com.dedicatedcode.geomesh.exception.InvalidArgumentException;
import com.dedicatedcode.geomesh.exception.UnknownDatasetException;
import com.dedicatedcode.geomesh.exception.UnsupportedDatasetOperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.dedicatedcode.geomesh.service.query.QueryDatasets.*;
import static org.junit.jupiter.api.Assertions.*;

class AssetFilterServiceTest {

    @TempDir
    Path tempDir;

    private AssetFilterService assetFilterService;

    private final List<AssetFilterRequest.Asset> assets = List.of(
            new AssetFilterRequest.Asset("plant-north", NORTH_LAT, NORTH_LON),
            new AssetFilterRequest.Asset("plant-south", SOUTH_LAT, SOUTH_LON),
            new AssetFilterRequest.Asset("plant-equator", 0.0, 0.0));

    @BeforeEach
    void setUp() {
        GeomeshFixture fixture = new GeomeshFixture(tempDir);
        QueryDatasets.create(fixture);
        assetFilterService = fixture.assetFilterService;
    }

    @Test
    void testConditionSelectsAssets() {
        List<AssetMatch> matches = assetFilterService.filter(new AssetFilterRequest(assets, List.of(
                flood(2020, new AssetFilterRequest.ColumnFilter("depth", ">", 1.0)))));

        assertEquals(1, matches.size());
        assertEquals("plant-north", matches.get(0).getId());
        assertEquals(2.0, matches.get(0).getDatasets().get("flood").get("depth"));
    }

    @Test
    void testWithoutConditionsEveryAssetWithRowMatches() {
        List<AssetMatch> matches = assetFilterService.filter(new AssetFilterRequest(assets, List.of(flood(2020))));

        assertEquals(2, matches.size());
        assertEquals("plant-north", matches.get(0).getId());
        assertEquals("plant-south", matches.get(1).getId());
    }

    @Test
    void testYearIsPartOfTheMatch() {
        List<AssetMatch> matches = assetFilterService.filter(new AssetFilterRequest(assets, List.of(
                flood(2021, new AssetFilterRequest.ColumnFilter("depth", "greater_than_or_equal", 3.0)))));
        assertEquals(1, matches.size());
        assertEquals(3.0, matches.get(0).getDatasets().get("flood").get("depth"));
    }

    @Test
    void testAllDatasetsMustMatch() {
        AssetFilterRequest.DatasetFilter temperature = new AssetFilterRequest.DatasetFilter("temperature",
                List.of(new AssetFilterRequest.ColumnFilter("depth", "<=", 12.0)));
        temperature.setYear(2020);

        List<AssetMatch> matches = assetFilterService.filter(new AssetFilterRequest(assets, List.of(flood(2020), temperature)));

        assertEquals(1, matches.size());
        assertEquals(2, matches.get(0).getDatasets().size());
        assertEquals(12.0, matches.get(0).getDatasets().get("temperature").get("depth"));
    }

    @Test
    void testRegisteredDatasetWithoutStoreMatchesNothing() {
        AssetFilterRequest.DatasetFilter empty = new AssetFilterRequest.DatasetFilter("empty", List.of());
        assertTrue(assetFilterService.filter(new AssetFilterRequest(assets, List.of(empty))).isEmpty());
    }

    @Test
    void testUnknownColumnFails() {
        assertThrows(InvalidArgumentException.class, () -> assetFilterService.filter(new AssetFilterRequest(assets, List.of(
                flood(2020, new AssetFilterRequest.ColumnFilter("height", ">", 1.0))))));
    }

    @Test
    void testFilterWithoutValueFails() {
        InvalidArgumentException exception = assertThrows(InvalidArgumentException.class,
                () -> assetFilterService.filter(new AssetFilterRequest(assets, List.of(
                        flood(2020, new AssetFilterRequest.ColumnFilter("depth", ">", null))))));
        assertTrue(exception.getMessage().contains("depth"));
    }

    @Test
    void testUnknownComparatorFails() {
        assertThrows(InvalidArgumentException.class, () -> assetFilterService.filter(new AssetFilterRequest(assets, List.of(
                flood(2020, new AssetFilterRequest.ColumnFilter("depth", "!=", 1.0))))));
    }

    @Test
    void testPointDatasetIsUnsupported() {
        assertThrows(UnsupportedDatasetOperationException.class, () -> assetFilterService.filter(new AssetFilterRequest(assets, List.of(
                new AssetFilterRequest.DatasetFilter("wells", List.of())))));
    }

    @Test
    void testUnknownDatasetFails() {
        assertThrows(UnknownDatasetException.class, () -> assetFilterService.filter(new AssetFilterRequest(assets, List.of(
                new AssetFilterRequest.DatasetFilter("unknown", List.of())))));
    }

    @Test
    void testNoDatasetFilterFails() {
        assertThrows(InvalidArgumentException.class, () -> assetFilterService.filter(new AssetFilterRequest(assets, List.of())));
    }

    private static AssetFilterRequest.DatasetFilter flood(int year, AssetFilterRequest.ColumnFilter... filters) {
        AssetFilterRequest.DatasetFilter filter = new AssetFilterRequest.DatasetFilter("flood", List.of(filters));
        filter.setYear(year);
        return filter;
    }
}

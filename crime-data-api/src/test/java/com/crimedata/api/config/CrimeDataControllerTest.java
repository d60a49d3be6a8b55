package com.crimedata.api.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests of the HTTP surface against the H2 fixture data
 * (24 agencies, 36 incidents over 2014-2016, 53 offenses).
 */
@SpringBootTest
@AutoConfigureMockMvc
class CrimeDataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private List<Map<String, Object>> getList(String url) throws Exception {
        String body = mockMvc.perform(get(url))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readValue(body, new TypeReference<List<Map<String, Object>>>() {
        });
    }

    @Test
    void statusEndpoint() throws Exception {
        mockMvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("crime-data-api"));
    }

    @Nested
    class Agencies {

        @Test
        void listsAgenciesWithOri() throws Exception {
            mockMvc.perform(get("/agencies/"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$", hasSize(10)))
                    .andExpect(jsonPath("$[0].ori").value("AL0040000"))
                    .andExpect(jsonPath("$[0].agency_id").value(4))
                    .andExpect(jsonPath("$[0].agency_name").exists())
                    .andExpect(jsonPath("$[0].state").value("AL"));
        }

        @Test
        void singleRecordWorks() throws Exception {
            String ori = (String) getList("/agencies/").get(0).get("ori");

            mockMvc.perform(get("/agencies/{ori}/", ori))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.ori").value(ori));
        }

        @Test
        void unknownOriIsNotFound() throws Exception {
            mockMvc.perform(get("/agencies/ZZ9990000/"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error", containsString("ZZ9990000")));
        }

        @Test
        void pagesDoNotOverlap() throws Exception {
            List<Map<String, Object>> page1 = getList("/agencies/?page=1");
            List<Map<String, Object>> page2 = getList("/agencies/?page=2&page_size=10");

            assertThat(page1).hasSize(10);
            assertThat(page2).hasSize(10).doesNotContainAnyElementsOf(page1);
        }

        @Test
        void pageSizeIsHonoured() throws Exception {
            assertThat(getList("/agencies/?page_size=5")).hasSize(5);
            assertThat(getList("/agencies/?page=3&page_size=10")).hasSize(4);
            assertThat(getList("/agencies/?page=9")).isEmpty();
        }

        @Test
        void largePageSizeReturnsAllAgencies() throws Exception {
            assertThat(getList("/agencies/?page_size=1000")).hasSize(24);
        }

        @Test
        void repeatedRequestsAreIdentical() throws Exception {
            assertThat(getList("/agencies/?page=2&page_size=7")).isEqualTo(getList("/agencies/?page=2&page_size=7"));
        }

        @Test
        void invalidPageSizeIsRejected() throws Exception {
            mockMvc.perform(get("/agencies/?page_size=0")).andExpect(status().isBadRequest());
            mockMvc.perform(get("/agencies/?page=abc")).andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error", containsString("page")))
                    .andExpect(jsonPath("$.parameter").value("page"));
        }
    }

    @Nested
    class Incidents {

        @Test
        void listsIncidentsWithAgencyOffensesAndLocations() throws Exception {
            List<Map<String, Object>> incidents = getList("/incidents/");

            assertThat(incidents).hasSize(10);
            assertThat(incidents.get(0)).containsEntry("incident_number", "INC-2014-0001");
            for (Map<String, Object> incident : incidents) {
                assertThat(incident).containsKeys("incident_number", "agency", "offenses", "year");
                assertThat(asMap(incident.get("agency"))).containsKey("ori");
                for (Object o : (List<?>) incident.get("offenses")) {
                    Map<String, Object> offense = asMap(o);
                    assertThat(asMap(offense.get("offense_type"))).containsKeys("offense_name", "offense_code");
                    assertThat(asMap(offense.get("location"))).containsKey("location_name");
                }
            }
        }

        @Test
        void filtersByOffenseCode() throws Exception {
            List<Map<String, Object>> incidents = getList("/incidents/?offense_code=35A&page_size=50");

            assertThat(incidents).hasSize(15);
            for (Map<String, Object> incident : incidents) {
                long hits = ((List<?>) incident.get("offenses")).stream()
                        .map(o -> asMap(asMap(o).get("offense_type")).get("offense_code"))
                        .filter("35A"::equals)
                        .count();
                assertThat(hits).isPositive();
            }
        }

        @Test
        void unmatchedOffenseCodeIsAnEmptyPage() throws Exception {
            assertThat(getList("/incidents/?offense_code=99Z")).isEmpty();
        }

        @Test
        void pagesDoNotOverlap() throws Exception {
            List<Map<String, Object>> page1 = getList("/incidents/?page=1");
            List<Map<String, Object>> page2 = getList("/incidents/?page=2");

            assertThat(page1).hasSize(10);
            assertThat(page2).hasSize(10);
            assertThat(page1).doesNotContain(page2.get(0));
        }

        @Test
        void pageSizeIsHonoured() throws Exception {
            assertThat(getList("/incidents/?page_size=5")).hasSize(5);
        }

        @Test
        void singleRecordWorks() throws Exception {
            String number = (String) getList("/incidents/").get(0).get("incident_number");

            mockMvc.perform(get("/incidents/{number}/", number))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.incident_number").value(number))
                    .andExpect(jsonPath("$.agency.ori").exists());
        }

        @Test
        void unknownIncidentIsNotFound() throws Exception {
            mockMvc.perform(get("/incidents/NOPE-1/")).andExpect(status().isNotFound());
        }

        @Test
        void malformedYearIsRejected() throws Exception {
            mockMvc.perform(get("/incidents/?year=last")).andExpect(status().isBadRequest());
        }
    }

    @Nested
    class Counts {

        @Test
        void returnsCountsGroupedByYearByDefault() throws Exception {
            List<Map<String, Object>> rows = getList("/incidents/count/");

            assertThat(rows).extracting(r -> r.get("year")).containsExactly(2014, 2015, 2016);
            assertThat(rows).allSatisfy(r -> assertThat(r)
                    .containsOnlyKeys("year", "total_actual_count")
                    .containsEntry("total_actual_count", 12));
        }

        @Test
        void groupsByAgencyId() throws Exception {
            List<Map<String, Object>> rows = getList("/incidents/count/?by=agency_id");

            List<Object> ids = rows.stream().map(r -> r.get("agency_id")).toList();
            assertThat(ids).hasSize(8).doesNotHaveDuplicates();
            assertThat(rows.get(0)).containsEntry("agency_id", 1).containsEntry("total_actual_count", 5);
        }

        @Test
        void agencyYearPairsAreUniqueAndCollapseIntoAgencyTotals() throws Exception {
            List<Map<String, Object>> pairs = getList("/incidents/count/?by=agency_id,year&page_size=100");
            List<Map<String, Object>> agencies = getList("/incidents/count/?by=agency_id");

            Set<List<Object>> keys = new HashSet<>();
            Map<Object, Integer> summed = new HashMap<>();
            for (Map<String, Object> row : pairs) {
                assertThat(keys.add(List.of(row.get("year"), row.get("agency_id")))).isTrue();
                summed.merge(row.get("agency_id"), (Integer) row.get("total_actual_count"), Integer::sum);
            }
            assertThat(keys).hasSize(24);

            Map<Object, Integer> collapsed = new HashMap<>();
            agencies.forEach(r -> collapsed.put(r.get("agency_id"), (Integer) r.get("total_actual_count")));
            assertThat(collapsed).isEqualTo(summed);
        }

        @Test
        void countsMatchTheUnderlyingRows() throws Exception {
            for (Map<String, Object> row : getList("/incidents/count/?by=agency_id,year&page_size=100")) {
                Integer expected = jdbcTemplate.queryForObject(
                        "SELECT COUNT(*) FROM incident WHERE agency_id = ? AND incident_year = ?",
                        Integer.class, row.get("agency_id"), row.get("year"));
                assertThat(row.get("total_actual_count")).isEqualTo(expected);
            }
        }

        @Test
        void groupsByState() throws Exception {
            List<Map<String, Object>> rows = getList("/incidents/count/?by=state");

            assertThat(rows).extracting(r -> r.get("state")).containsExactly("AL", "CO", "KY", "VA");
            assertThat(rows).allSatisfy(r -> assertThat(r).containsEntry("total_actual_count", 9));
        }

        @Test
        void groupsByOffenseCountingOccurrences() throws Exception {
            List<Map<String, Object>> rows = getList("/incidents/count/?by=offense");

            List<Object> offenses = rows.stream().map(r -> r.get("offense")).toList();
            assertThat(offenses).hasSize(7).doesNotHaveDuplicates();
            assertThat(rows.stream().mapToInt(r -> (Integer) r.get("total_actual_count")).sum()).isEqualTo(53);
            assertThat(rows).filteredOn(r -> "Drug/Narcotic Violations".equals(r.get("offense")))
                    .singleElement()
                    .satisfies(r -> assertThat(r).containsEntry("total_actual_count", 15));
        }

        @Test
        void offenseFilterRestrictsWhatIsCounted() throws Exception {
            assertThat(getList("/incidents/count/?by=offense&offense_code=35A"))
                    .containsExactly(Map.<String, Object>of("offense", "Drug/Narcotic Violations", "total_actual_count", 15));

            List<Map<String, Object>> byYear = getList("/incidents/count/?offense_code=35A");
            assertThat(byYear).extracting(r -> r.get("total_actual_count")).containsExactly(2, 1, 12);
        }

        @Test
        void showsRequestedFields() throws Exception {
            List<Map<String, Object>> rows = getList("/incidents/count/?fields=leoka_felony");

            assertThat(rows).isNotEmpty().allSatisfy(r -> assertThat(r).containsOnlyKeys("year", "leoka_felony"));
            assertThat(rows).extracting(r -> r.get("leoka_felony")).containsExactly(2, 0, 0);
        }

        @Test
        void multipleFieldsKeepRequestOrder() throws Exception {
            mockMvc.perform(get("/incidents/count/?fields=leoka_assault,total_actual_count,leoka_accident"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[1].year").value(2015))
                    .andExpect(jsonPath("$[1].leoka_assault").value(4))
                    .andExpect(jsonPath("$[2].leoka_accident").value(1))
                    .andExpect(content().string(containsString(
                            "{\"year\":2014,\"leoka_assault\":2,\"total_actual_count\":12,\"leoka_accident\":0}")));
        }

        @Test
        void pagesAggregateRows() throws Exception {
            List<Map<String, Object>> all = getList("/incidents/count/?by=agency_id,year&page_size=24");
            List<Map<String, Object>> page1 = getList("/incidents/count/?by=agency_id,year&page_size=5");
            List<Map<String, Object>> page2 = getList("/incidents/count/?by=agency_id,year&page=2&page_size=5");

            assertThat(page1).hasSize(5);
            List<Map<String, Object>> union = new ArrayList<>(page1);
            union.addAll(page2);
            assertThat(union).isEqualTo(all.subList(0, 10));
            assertThat(getList("/incidents/count/?by=agency_id,year&page=6&page_size=5")).isEmpty();
        }

        @Test
        void largePageSizeReturnsEveryRow() throws Exception {
            assertThat(getList("/incidents/count/?by=agency_id,year&page_size=1000")).hasSize(24);
            assertThat(getList("/incidents/?page_size=1000")).hasSize(36);
        }

        @Test
        void rendersCsv() throws Exception {
            mockMvc.perform(get("/incidents/count/?by=state&output=csv"))
                    .andExpect(status().isOk())
                    .andExpect(content().contentTypeCompatibleWith("text/csv"))
                    .andExpect(content().string(containsString("\"state\",\"total_actual_count\"")))
                    .andExpect(content().string(containsString("\"VA\",\"9\"")));
        }

        @Test
        void unknownDimensionIsRejectedWithNoRows() throws Exception {
            mockMvc.perform(get("/incidents/count/?by=bogus"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error", containsString("bogus")))
                    .andExpect(jsonPath("$.parameter").value("by"));
        }

        @Test
        void unknownFieldIsRejected() throws Exception {
            mockMvc.perform(get("/incidents/count/?fields=leoka_unknown"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error", containsString("leoka_unknown")))
                    .andExpect(jsonPath("$.parameter").value("fields"));
        }

        @Test
        void unknownOutputFormatIsRejected() throws Exception {
            mockMvc.perform(get("/incidents/count/?output=xml")).andExpect(status().isBadRequest());
        }
    }

    @Test
    void listsOffenseTypes() throws Exception {
        mockMvc.perform(get("/offenses/types/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(8)))
                .andExpect(jsonPath("$[0].offense_code").value("09A"));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object o) {
        return (Map<String, Object>) o;
    }
}
